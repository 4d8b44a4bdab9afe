package app.corvana.importer.service.session;

import java.util.List;

/**
 * Outcome of a commit. {@code imported + failed + skippedDuplicates + skippedUnmatched} equals the number of valid
 * rows that were considered; invalid rows are not counted anywhere.
 */
public record ImportResult(
        boolean success,
        int imported,
        int failed,
        int skippedDuplicates,
        int skippedUnmatched,
        int subEntitiesCreated,
        int contactsForExistingLeads,
        List<String> errors,
        List<String> unmatchedNames
) {
    public ImportResult {
        errors = List.copyOf(errors);
        unmatchedNames = List.copyOf(unmatchedNames);
    }
}
