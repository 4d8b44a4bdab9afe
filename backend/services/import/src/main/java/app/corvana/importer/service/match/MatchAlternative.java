package app.corvana.importer.service.match;

import java.util.UUID;

public record MatchAlternative(
        UUID id,
        String name,
        int confidence
) {
}
