package app.corvana.importer.service.session;

import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.match.AnnotatedCandidate;

import java.util.List;

/**
 * Decides what happens to each annotated row on commit.
 */
public final class CandidateSelection {

    public enum Disposition {
        accepted,
        invalid,
        unmatched,
        duplicate
    }

    private CandidateSelection() {
    }

    public static Disposition classify(AnnotatedCandidate item, EntityType type, ImportOptions options) {
        if (!item.candidate().valid()) {
            return Disposition.invalid;
        }
        if (type.leadReferencing() && !item.isMatched()) {
            return Disposition.unmatched;
        }
        if (item.isDuplicate() && !options.includeDuplicates()) {
            return Disposition.duplicate;
        }
        return Disposition.accepted;
    }

    public static long committableCount(List<AnnotatedCandidate> candidates, EntityType type, ImportOptions options) {
        return candidates.stream()
                .filter(item -> classify(item, type, options) == Disposition.accepted)
                .count();
    }
}
