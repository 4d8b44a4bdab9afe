package app.corvana.importer.controller.dto;

import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.match.AnnotatedCandidate;
import app.corvana.importer.service.session.CandidateSelection;
import app.corvana.importer.service.session.ImportOptions;

import java.util.List;

public record PreviewSummary(
        int total,
        int valid,
        int invalid,
        int duplicates,
        int unmatched,
        int committable
) {
    public static PreviewSummary of(List<AnnotatedCandidate> candidates, EntityType type, ImportOptions options) {
        int valid = 0;
        int duplicates = 0;
        int unmatched = 0;
        int committable = 0;
        for (AnnotatedCandidate item : candidates) {
            if (item.candidate().valid()) {
                valid++;
            }
            if (item.isDuplicate()) {
                duplicates++;
            }
            switch (CandidateSelection.classify(item, type, options)) {
                case accepted -> committable++;
                case unmatched -> unmatched++;
                default -> {
                    // counted above
                }
            }
        }
        return new PreviewSummary(candidates.size(), valid, candidates.size() - valid, duplicates, unmatched, committable);
    }
}
