package app.corvana.importer.service.mapping;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.HashMap;
import java.util.Map;

/**
 * Columns of one repeated contact group on a lead row, keyed by contact field key.
 */
public record ContactSlotMapping(
        Map<String, Integer> columns
) {
    public ContactSlotMapping {
        columns = FieldMapping.mappedColumns(columns);
    }

    public Integer column(String key) {
        return columns.get(key);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return columns.isEmpty();
    }

    public ContactSlotMapping withColumn(String key, Integer column) {
        Map<String, Integer> copy = new HashMap<>(columns);
        if (column == null) {
            copy.remove(key);
        } else {
            copy.put(key, column);
        }
        return new ContactSlotMapping(copy);
    }
}
