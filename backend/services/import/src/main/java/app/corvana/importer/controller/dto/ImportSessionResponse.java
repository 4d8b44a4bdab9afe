package app.corvana.importer.controller.dto;

import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.mapping.CanonicalField;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.match.AnnotatedCandidate;
import app.corvana.importer.service.session.ImportOptions;
import app.corvana.importer.service.session.ImportResult;
import app.corvana.importer.service.session.ImportSession;
import app.corvana.importer.service.session.ImportSessionState;
import app.corvana.importer.service.session.ImportStep;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ImportSessionResponse(
        UUID sessionId,
        ImportStep step,
        EntityType entityType,
        UUID accountId,
        String fileName,
        List<String> headers,
        List<List<String>> sampleRows,
        int rowCount,
        List<CanonicalField> fields,
        List<CanonicalField> contactSlotFields,
        FieldMapping mapping,
        Map<String, Integer> detectedConfidence,
        List<String> mappingErrors,
        List<AnnotatedCandidate> candidates,
        PreviewSummary summary,
        ImportOptions options,
        boolean committing,
        ImportResult result
) {
    private static final int SAMPLE_ROWS = 5;

    public static ImportSessionResponse from(ImportSession session,
                                             List<CanonicalField> fields,
                                             List<CanonicalField> contactSlotFields,
                                             List<String> mappingErrors) {
        ImportSessionState state = session.state();
        List<String> headers = state.table() == null ? List.of() : state.table().headers();
        List<List<String>> sample = state.table() == null
                ? List.of()
                : state.table().rows().subList(0, Math.min(SAMPLE_ROWS, state.table().rowCount()));
        PreviewSummary summary = state.candidates().isEmpty()
                ? null
                : PreviewSummary.of(state.candidates(), state.entityType(), state.options());
        return new ImportSessionResponse(
                session.id(),
                state.step(),
                state.entityType(),
                state.accountId(),
                state.fileName(),
                headers,
                sample,
                state.table() == null ? 0 : state.table().rowCount(),
                fields,
                contactSlotFields,
                state.mapping(),
                state.detectedMapping() == null ? Map.of() : state.detectedMapping().confidence(),
                mappingErrors,
                state.candidates(),
                summary,
                state.options(),
                session.committing(),
                state.result()
        );
    }
}
