package app.corvana.importer.service.session;

/**
 * Commit policies the user can toggle on the preview step. Rows whose parent lead could not be matched are never
 * committed, so {@code includeUnmatched} is always false.
 */
public record ImportOptions(
        boolean includeDuplicates,
        boolean includeUnmatched
) {
    public ImportOptions {
        includeUnmatched = false;
    }

    public static ImportOptions defaults() {
        return new ImportOptions(false, false);
    }
}
