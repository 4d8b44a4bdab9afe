package app.corvana.importer.service.match;

import java.util.UUID;

/**
 * Why a candidate is considered already present. {@code matchedExistingId} points at a stored record,
 * {@code duplicateOfRow} at an earlier row of the same file; exactly one of them is set.
 */
public record DuplicateAnnotation(
        boolean duplicate,
        UUID matchedExistingId,
        Integer duplicateOfRow,
        DuplicateReason reason
) {
    public static DuplicateAnnotation ofExisting(UUID existingId, DuplicateReason reason) {
        return new DuplicateAnnotation(true, existingId, null, reason);
    }

    public static DuplicateAnnotation ofRow(int rowIndex) {
        return new DuplicateAnnotation(true, null, rowIndex, DuplicateReason.repeated_in_file);
    }
}
