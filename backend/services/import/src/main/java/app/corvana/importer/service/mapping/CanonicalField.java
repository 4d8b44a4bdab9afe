package app.corvana.importer.service.mapping;

import java.util.List;

/**
 * A target field of an entity type. The first synonym is the strongest one.
 */
public record CanonicalField(
        String key,
        String label,
        boolean required,
        List<String> synonyms
) {
    public CanonicalField {
        synonyms = List.copyOf(synonyms);
    }

    public static CanonicalField required(String key, String label, String... synonyms) {
        return new CanonicalField(key, label, true, List.of(synonyms));
    }

    public static CanonicalField optional(String key, String label, String... synonyms) {
        return new CanonicalField(key, label, false, List.of(synonyms));
    }
}
