package app.corvana.importer.service.mapping;

import java.util.Map;

/**
 * A proposed mapping with the detector's confidence (0-100) for every field it filled in.
 */
public record DetectedMapping(
        FieldMapping mapping,
        Map<String, Integer> confidence
) {
    public DetectedMapping {
        confidence = Map.copyOf(confidence);
    }

    public int confidenceOf(String key) {
        return confidence.getOrDefault(key, 0);
    }
}
