package app.corvana.importer.service.parser;

import java.util.List;

/**
 * Raw header row and data rows of an uploaded file. Every row has exactly as many cells as there are headers.
 */
public record ParsedTable(
        List<String> headers,
        List<List<String>> rows
) {
    public ParsedTable {
        headers = List.copyOf(headers);
        rows = rows.stream().map(List::copyOf).toList();
    }

    public int rowCount() {
        return rows.size();
    }

    public String cell(int rowIndex, Integer columnIndex) {
        if (columnIndex == null || columnIndex < 0 || columnIndex >= headers.size()) {
            return null;
        }
        return rows.get(rowIndex).get(columnIndex);
    }
}
