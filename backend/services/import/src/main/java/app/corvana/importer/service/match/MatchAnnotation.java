package app.corvana.importer.service.match;

import java.util.List;
import java.util.UUID;

/**
 * Best existing lead for a reference name. {@code matchedRecordId} is null when the best score is below the
 * threshold; {@code matchedName} and {@code matchConfidence} still describe that best guess.
 */
public record MatchAnnotation(
        UUID matchedRecordId,
        String matchedName,
        int matchConfidence,
        List<MatchAlternative> alternatives
) {
    public MatchAnnotation {
        alternatives = List.copyOf(alternatives);
    }

    public static MatchAnnotation none() {
        return new MatchAnnotation(null, null, 0, List.of());
    }

    public boolean matched() {
        return matchedRecordId != null;
    }
}
