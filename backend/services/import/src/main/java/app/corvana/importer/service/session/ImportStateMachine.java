package app.corvana.importer.service.session;

import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.mapping.DetectedMapping;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.mapping.MappingValidation;
import app.corvana.importer.service.match.AnnotatedCandidate;
import app.corvana.importer.service.parser.ParsedTable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Import wizard transitions. Every method returns a new state and leaves its input untouched;
 * a transition that is not allowed from the current step throws {@link IllegalImportTransitionException}.
 */
@Component
public class ImportStateMachine {

    public ImportSessionState selectEntityType(ImportSessionState state, EntityType type, UUID accountId) {
        boolean allowed = state.step() == ImportStep.select_entity_type
                || (state.step() == ImportStep.upload && state.table() == null);
        if (!allowed) {
            throw illegal(state, "select an entity type");
        }
        if (type == null) {
            throw new IllegalImportTransitionException("Entity type is required");
        }
        if (type == EntityType.transaction && accountId == null) {
            throw new IllegalImportTransitionException("Transactions are imported into an account; accountId is required");
        }
        return new ImportSessionState(ImportStep.upload, type, type == EntityType.transaction ? accountId : null,
                null, null, null, null, List.of(), ImportOptions.defaults(), null);
    }

    public ImportSessionState upload(ImportSessionState state, String fileName, ParsedTable table, DetectedMapping detected) {
        if (state.step() != ImportStep.upload && state.step() != ImportStep.map_columns) {
            throw illegal(state, "upload a file");
        }
        if (table == null || detected == null) {
            throw new IllegalImportTransitionException("A parsed file is required");
        }
        return new ImportSessionState(ImportStep.map_columns, state.entityType(), state.accountId(), fileName,
                table, detected, detected.mapping(), List.of(), ImportOptions.defaults(), null);
    }

    public ImportSessionState editMapping(ImportSessionState state, FieldMapping mapping) {
        requireStep(state, ImportStep.map_columns, "edit the mapping");
        if (mapping == null) {
            throw new IllegalImportTransitionException("Mapping is required");
        }
        return new ImportSessionState(state.step(), state.entityType(), state.accountId(), state.fileName(),
                state.table(), state.detectedMapping(), mapping, List.of(), state.options(), null);
    }

    public ImportSessionState preview(ImportSessionState state, MappingValidation validation, List<AnnotatedCandidate> candidates) {
        requireStep(state, ImportStep.map_columns, "preview");
        if (validation == null || !validation.valid()) {
            String reason = validation == null ? "mapping was not validated" : String.join("; ", validation.errors());
            throw new IllegalImportTransitionException("Mapping is not valid: " + reason);
        }
        return new ImportSessionState(ImportStep.preview, state.entityType(), state.accountId(), state.fileName(),
                state.table(), state.detectedMapping(), state.mapping(), candidates, ImportOptions.defaults(), null);
    }

    public ImportSessionState back(ImportSessionState state) {
        return switch (state.step()) {
            case upload -> new ImportSessionState(ImportStep.select_entity_type, state.entityType(), state.accountId(),
                    null, null, null, null, List.of(), ImportOptions.defaults(), null);
            case map_columns -> new ImportSessionState(ImportStep.upload, state.entityType(), state.accountId(),
                    null, null, null, null, List.of(), ImportOptions.defaults(), null);
            // annotations depend on the mapping, so they are dropped
            case preview -> new ImportSessionState(ImportStep.map_columns, state.entityType(), state.accountId(),
                    state.fileName(), state.table(), state.detectedMapping(), state.mapping(), List.of(),
                    ImportOptions.defaults(), null);
            // an import that failed, wholly or for some rows, can be reviewed and committed again
            case complete -> {
                if (!hasFailures(state.result())) {
                    throw illegal(state, "go back");
                }
                yield new ImportSessionState(ImportStep.preview, state.entityType(), state.accountId(),
                        state.fileName(), state.table(), state.detectedMapping(), state.mapping(),
                        state.candidates(), state.options(), null);
            }
            default -> throw illegal(state, "go back");
        };
    }

    public ImportSessionState updateOptions(ImportSessionState state, ImportOptions options) {
        requireStep(state, ImportStep.preview, "change import options");
        return new ImportSessionState(state.step(), state.entityType(), state.accountId(), state.fileName(),
                state.table(), state.detectedMapping(), state.mapping(), state.candidates(),
                options == null ? ImportOptions.defaults() : options, null);
    }

    /**
     * Starts the commit from {@code preview}, or again from {@code complete} when the previous batch call failed as
     * a whole and nothing was written.
     */
    public ImportSessionState beginImport(ImportSessionState state) {
        if (!(state.step() == ImportStep.complete && nothingWritten(state.result()))) {
            requireStep(state, ImportStep.preview, "start the import");
        }
        if (CandidateSelection.committableCount(state.candidates(), state.entityType(), state.options()) == 0) {
            throw new IllegalImportTransitionException("Nothing to import: no row passes validation and the current options");
        }
        return withStep(state, ImportStep.importing, null);
    }

    public ImportSessionState completeImport(ImportSessionState state, ImportResult result) {
        requireStep(state, ImportStep.importing, "complete the import");
        return withStep(state, ImportStep.complete, result);
    }

    private ImportSessionState withStep(ImportSessionState state, ImportStep step, ImportResult result) {
        return new ImportSessionState(step, state.entityType(), state.accountId(), state.fileName(), state.table(),
                state.detectedMapping(), state.mapping(), state.candidates(), state.options(), result);
    }

    private boolean nothingWritten(ImportResult result) {
        return result != null && !result.success() && result.imported() == 0 && result.contactsForExistingLeads() == 0;
    }

    private boolean hasFailures(ImportResult result) {
        return result != null && (!result.success() || result.failed() > 0);
    }

    private void requireStep(ImportSessionState state, ImportStep expected, String action) {
        if (state.step() != expected) {
            throw illegal(state, action);
        }
    }

    private IllegalImportTransitionException illegal(ImportSessionState state, String action) {
        return new IllegalImportTransitionException("Cannot " + action + " while the session is at step " + state.step());
    }
}
