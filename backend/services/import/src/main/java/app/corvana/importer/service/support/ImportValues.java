package app.corvana.importer.service.support;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient conversions from spreadsheet cell text to typed values. Every parser returns {@code null} for blank or
 * unrecognized input instead of throwing.
 */
public final class ImportValues {

    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})(?:[T ].*)?$");
    private static final Pattern NUMERIC_DATE = Pattern.compile("^(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{2}|\\d{4})$");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{IsAlphabetic}\\p{IsDigit}]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CURRENCY_NOISE = Pattern.compile("[$€£¥\\s,]|\\b(?:USD|EUR|GBP|CAD|AUD)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAIN_NUMBER = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final List<DateTimeFormatter> TEXT_DATE_FORMATS = List.of(
            textFormat("MMM d, uuuu"),
            textFormat("MMMM d, uuuu"),
            textFormat("d MMM uuuu"),
            textFormat("d MMMM uuuu"),
            textFormat("MMM d uuuu")
    );

    private ImportValues() {
    }

    public static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static LocalDate parseDate(String raw) {
        String value = clean(raw);
        if (value == null) {
            return null;
        }

        Matcher iso = ISO_DATE.matcher(value);
        if (iso.matches()) {
            return safeDate(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(3)));
        }

        Matcher numeric = NUMERIC_DATE.matcher(value);
        if (numeric.matches()) {
            int first = Integer.parseInt(numeric.group(1));
            int second = Integer.parseInt(numeric.group(2));
            int year = Integer.parseInt(numeric.group(3));
            if (numeric.group(3).length() == 2) {
                year += 2000;
            }
            // month first unless the first part can only be a day
            if (first > 12) {
                return safeDate(year, second, first);
            }
            return safeDate(year, first, second);
        }

        for (DateTimeFormatter format : TEXT_DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException ignored) {
                // next shape
            }
        }
        return null;
    }

    public static BigDecimal parseAmount(String raw) {
        String value = clean(raw);
        if (value == null) {
            return null;
        }
        boolean negative = false;
        if (value.startsWith("(") && value.endsWith(")")) {
            negative = true;
            value = value.substring(1, value.length() - 1);
        }
        if (value.endsWith("-")) {
            negative = true;
            value = value.substring(0, value.length() - 1);
        }
        String compact = CURRENCY_NOISE.matcher(value).replaceAll("");
        if (!PLAIN_NUMBER.matcher(compact).matches()) {
            return null;
        }
        BigDecimal amount = new BigDecimal(compact);
        return negative ? amount.abs().negate() : amount;
    }

    public static Integer parseProbability(String raw) {
        String value = clean(raw);
        if (value == null) {
            return null;
        }
        if (value.endsWith("%")) {
            value = value.substring(0, value.length() - 1).trim();
        }
        if (!PLAIN_NUMBER.matcher(value).matches()) {
            return null;
        }
        BigDecimal number = new BigDecimal(value);
        if (number.signum() < 0 || number.compareTo(BigDecimal.valueOf(100)) > 0) {
            return null;
        }
        return number.setScale(0, RoundingMode.HALF_UP).intValue();
    }

    public static boolean isEmail(String value) {
        return value != null && EMAIL.matcher(value).matches();
    }

    /**
     * Lower-cases, drops punctuation and collapses whitespace, so that "Acme Corp." and " acme  corp" compare equal.
     */
    public static String normalizeName(String value) {
        if (value == null) {
            return "";
        }
        String lowered = value.toLowerCase(Locale.ROOT);
        String compact = NON_ALNUM.matcher(lowered).replaceAll(" ").trim();
        return WHITESPACE.matcher(compact).replaceAll(" ");
    }

    /**
     * Host part of a website, without scheme, {@code www.}, port, path or case. Returns {@code null} for blanks.
     */
    public static String websiteDomain(String website) {
        String value = clean(website);
        if (value == null) {
            return null;
        }
        String host = value.toLowerCase(Locale.ROOT);
        int scheme = host.indexOf("://");
        if (scheme >= 0) {
            host = host.substring(scheme + 3);
        }
        int end = host.length();
        for (char stop : new char[]{'/', '?', '#', ':'}) {
            int idx = host.indexOf(stop);
            if (idx >= 0 && idx < end) {
                end = idx;
            }
        }
        host = host.substring(0, end);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host.isBlank() ? null : host;
    }

    private static LocalDate safeDate(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException ex) {
            return null;
        }
    }

    private static DateTimeFormatter textFormat(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
