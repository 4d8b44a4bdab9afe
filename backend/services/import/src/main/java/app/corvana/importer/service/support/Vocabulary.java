package app.corvana.importer.service.support;

import java.util.Locale;

/**
 * Closed set of values that a cell may spell either as the stored value or as its display label.
 */
public interface Vocabulary {

    String value();

    String label();

    static <T extends Enum<T> & Vocabulary> T parse(String raw, Class<T> type, T fallback) {
        String cleaned = ImportValues.clean(raw);
        if (cleaned == null) {
            return fallback;
        }
        String lowered = cleaned.toLowerCase(Locale.ROOT);
        for (T constant : type.getEnumConstants()) {
            if (constant.value().equals(lowered) || constant.label().toLowerCase(Locale.ROOT).equals(lowered)) {
                return constant;
            }
        }
        return fallback;
    }
}
