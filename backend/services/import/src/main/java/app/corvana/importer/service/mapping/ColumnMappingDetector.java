package app.corvana.importer.service.mapping;

import app.corvana.importer.service.support.ImportValues;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Proposes a header-to-field mapping from header text alone. Never fails: headers that look like nothing
 * simply stay unmapped.
 */
@Component
public class ColumnMappingDetector {

    private static final int EXACT_SCORE = 100;
    private static final int PARTIAL_BASE = 60;
    private static final int PARTIAL_SPAN = 30;
    private static final int PRIMARY_SLOT = 0;
    private static final Pattern CONTACT_NUMBERED = Pattern.compile("^contact ?(\\d+)(?: (.+))?$");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("^(.+?) ?(\\d+)$");

    public DetectedMapping detect(List<String> headers, List<CanonicalField> fields) {
        return detect(headers, fields, List.of(), 0);
    }

    public DetectedMapping detect(List<String> headers,
                                  List<CanonicalField> fields,
                                  List<CanonicalField> slotFields,
                                  int maxSlots) {
        List<String> normalized = headers.stream()
                .map(ImportValues::normalizeName)
                .toList();

        Set<Integer> claimed = new HashSet<>();
        List<ContactSlotMapping> slots = List.of();
        if (!slotFields.isEmpty() && maxSlots > 0) {
            slots = detectContactSlots(normalized, slotFields, maxSlots, claimed);
        }

        List<Scored> scored = new ArrayList<>();
        for (int f = 0; f < fields.size(); f++) {
            CanonicalField field = fields.get(f);
            for (int h = 0; h < normalized.size(); h++) {
                if (claimed.contains(h)) {
                    continue;
                }
                int score = score(normalized.get(h), field.synonyms());
                if (score > 0) {
                    scored.add(new Scored(f, h, score));
                }
            }
        }
        scored.sort(Comparator.comparingInt(Scored::score).reversed()
                .thenComparingInt(Scored::fieldOrder)
                .thenComparingInt(Scored::header));

        Map<String, Integer> columns = new HashMap<>();
        Map<String, Integer> confidence = new HashMap<>();
        Set<Integer> usedHeaders = new HashSet<>();
        for (Scored candidate : scored) {
            String key = fields.get(candidate.fieldOrder()).key();
            if (columns.containsKey(key) || usedHeaders.contains(candidate.header())) {
                continue;
            }
            columns.put(key, candidate.header());
            confidence.put(key, candidate.score());
            usedHeaders.add(candidate.header());
        }
        return new DetectedMapping(new FieldMapping(columns, slots), confidence);
    }

    int score(String header, List<String> synonyms) {
        if (header.isEmpty()) {
            return 0;
        }
        int best = 0;
        for (int rank = 0; rank < synonyms.size(); rank++) {
            String synonym = ImportValues.normalizeName(synonyms.get(rank));
            if (synonym.isEmpty()) {
                continue;
            }
            int score;
            if (header.equals(synonym)) {
                score = EXACT_SCORE - rank;
            } else if (containsWords(header, synonym)) {
                long coverage = Math.round((double) PARTIAL_SPAN * synonym.length() / header.length());
                score = PARTIAL_BASE + (int) coverage - rank;
            } else {
                continue;
            }
            best = Math.max(best, score);
        }
        return Math.max(0, Math.min(EXACT_SCORE, best));
    }

    private List<ContactSlotMapping> detectContactSlots(List<String> headers,
                                                        List<CanonicalField> slotFields,
                                                        int maxSlots,
                                                        Set<Integer> claimed) {
        TreeMap<Integer, Map<String, Integer>> groups = new TreeMap<>();
        for (int h = 0; h < headers.size(); h++) {
            SlotHit hit = slotHit(headers.get(h), slotFields);
            if (hit == null) {
                continue;
            }
            Map<String, Integer> group = groups.computeIfAbsent(hit.number(), n -> new LinkedHashMap<>());
            group.putIfAbsent(hit.key(), h);
        }

        List<ContactSlotMapping> slots = new ArrayList<>();
        for (Map<String, Integer> group : groups.values()) {
            if (slots.size() >= maxSlots) {
                break;
            }
            slots.add(new ContactSlotMapping(group));
            claimed.addAll(group.values());
        }
        return slots;
    }

    private SlotHit slotHit(String header, List<CanonicalField> slotFields) {
        if (header.isEmpty()) {
            return null;
        }
        Matcher contact = CONTACT_NUMBERED.matcher(header);
        if (contact.matches()) {
            int number = parseNumber(contact.group(1));
            String rest = contact.group(2);
            if (rest == null) {
                // a bare "Contact N" column holds the contact's first name
                return new SlotHit(number, slotFields.get(0).key());
            }
            String key = exactSlotField(rest, slotFields);
            return key == null ? null : new SlotHit(number, key);
        }
        Matcher trailing = TRAILING_NUMBER.matcher(header);
        if (trailing.matches()) {
            String key = exactSlotField(trailing.group(1).trim(), slotFields);
            if (key != null) {
                return new SlotHit(parseNumber(trailing.group(2)), key);
            }
        }
        String key = exactSlotField(header, slotFields);
        return key == null ? null : new SlotHit(PRIMARY_SLOT, key);
    }

    private String exactSlotField(String phrase, List<CanonicalField> slotFields) {
        for (CanonicalField field : slotFields) {
            for (String synonym : field.synonyms()) {
                if (ImportValues.normalizeName(synonym).equals(phrase)) {
                    return field.key();
                }
            }
        }
        return null;
    }

    private int parseNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            return Integer.MAX_VALUE;
        }
    }

    private static boolean containsWords(String header, String phrase) {
        return phrase.length() < header.length()
                && (" " + header + " ").contains(" " + phrase + " ");
    }

    private record Scored(int fieldOrder, int header, int score) {
    }

    private record SlotHit(int number, String key) {
    }
}
