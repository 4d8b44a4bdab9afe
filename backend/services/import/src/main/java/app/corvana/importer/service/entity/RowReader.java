package app.corvana.importer.service.entity;

import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.parser.ParsedTable;
import app.corvana.importer.service.support.ImportValues;

import java.util.List;

final class RowReader {

    private final ParsedTable table;
    private final int rowIndex;
    private final FieldMapping mapping;

    RowReader(ParsedTable table, int rowIndex, FieldMapping mapping) {
        this.table = table;
        this.rowIndex = rowIndex;
        this.mapping = mapping;
    }

    String raw(String key) {
        return cell(mapping.column(key));
    }

    String text(String key) {
        return ImportValues.clean(raw(key));
    }

    String cell(Integer column) {
        return table.cell(rowIndex, column);
    }

    String required(String key, String label, List<String> errors) {
        String value = text(key);
        if (value == null) {
            errors.add(label + " is required");
        }
        return value;
    }
}
