package app.corvana.importer.service.session;

import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.mapping.DetectedMapping;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.match.AnnotatedCandidate;
import app.corvana.importer.service.parser.ParsedTable;

import java.util.List;
import java.util.UUID;

public record ImportSessionState(
        ImportStep step,
        EntityType entityType,
        UUID accountId,
        String fileName,
        ParsedTable table,
        DetectedMapping detectedMapping,
        FieldMapping mapping,
        List<AnnotatedCandidate> candidates,
        ImportOptions options,
        ImportResult result
) {
    public ImportSessionState {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        options = options == null ? ImportOptions.defaults() : options;
    }

    public static ImportSessionState initial() {
        return new ImportSessionState(ImportStep.select_entity_type, null, null, null, null, null, null,
                List.of(), ImportOptions.defaults(), null);
    }
}
