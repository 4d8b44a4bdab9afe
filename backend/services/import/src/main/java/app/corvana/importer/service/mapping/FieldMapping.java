package app.corvana.importer.service.mapping;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical field key to header index. An absent key means the field is unmapped.
 */
public record FieldMapping(
        Map<String, Integer> columns,
        List<ContactSlotMapping> contactSlots
) {
    public FieldMapping {
        columns = mappedColumns(columns);
        contactSlots = contactSlots == null
                ? List.of()
                : contactSlots.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Copy of {@code columns} without the entries whose index is null. A null index means the field is unmapped.
     */
    static Map<String, Integer> mappedColumns(Map<String, Integer> columns) {
        if (columns == null) {
            return Map.of();
        }
        Map<String, Integer> mapped = new HashMap<>();
        columns.forEach((key, column) -> {
            if (key != null && column != null) {
                mapped.put(key, column);
            }
        });
        return Map.copyOf(mapped);
    }

    public static FieldMapping empty() {
        return new FieldMapping(Map.of(), List.of());
    }

    public static FieldMapping of(Map<String, Integer> columns) {
        return new FieldMapping(columns, List.of());
    }

    public Integer column(String key) {
        return columns.get(key);
    }

    public boolean isMapped(String key) {
        return columns.containsKey(key);
    }

    public FieldMapping withColumn(String key, Integer column) {
        Map<String, Integer> copy = new HashMap<>(columns);
        if (column == null) {
            copy.remove(key);
        } else {
            copy.put(key, column);
        }
        return new FieldMapping(copy, contactSlots);
    }
}
