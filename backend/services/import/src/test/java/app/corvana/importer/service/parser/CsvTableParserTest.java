package app.corvana.importer.service.parser;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CsvTableParserTest {

    private final CsvTableParser parser = new CsvTableParser();

    @Test
    void keepsDelimitersAndEscapedQuotesInsideQuotedCells() {
        ParsedTable table = parser.parse("name,note\r\n\"Acme, Inc\",\"says \"\"hi\"\"\"\r\n", null);

        assertEquals(List.of("name", "note"), table.headers());
        assertEquals(List.of("Acme, Inc", "says \"hi\""), table.rows().get(0));
    }

    @Test
    void keepsNewlinesInsideQuotedCells() {
        ParsedTable table = parser.parse("a,b\n\"line one\nline two\",x\n", null);

        assertEquals(1, table.rowCount());
        assertEquals("line one\nline two", table.cell(0, 0));
    }

    @Test
    void dropsBlankRowsAndFitsRowsToHeaderWidth() {
        ParsedTable table = parser.parse("a,b,c\n1\n , ,\n\n1,2,3,4\n", null);

        assertEquals(2, table.rowCount());
        assertEquals(List.of("1", "", ""), table.rows().get(0));
        assertEquals(List.of("1", "2", "3"), table.rows().get(1));
    }

    @Test
    void trimsCells() {
        ParsedTable table = parser.parse(" Date , Amount \n 2024-01-05 ,  12.50 \n", null);

        assertEquals(List.of("Date", "Amount"), table.headers());
        assertEquals(List.of("2024-01-05", "12.50"), table.rows().get(0));
    }

    @Test
    void detectsSemicolonAndTabDelimiters() {
        assertEquals(3, parser.parse("a;b;c\n1;2;3\n", null).headers().size());
        assertEquals(List.of("1", "2"), parser.parse("a\tb\n1\t2\n", null).rows().get(0));
    }

    @Test
    void commaWinsDelimiterTies() {
        assertEquals(',', parser.detectDelimiter("a,b;c"));
        assertEquals(',', parser.detectDelimiter("single"));
        assertEquals(';', parser.detectDelimiter("\"x,y\";b;c"));
    }

    @Test
    void explicitDelimiterOverridesDetection() {
        ParsedTable table = parser.parse("a|b,c\n1|2,3\n", '|');

        assertEquals(List.of("a", "b,c"), table.headers());
    }

    @Test
    void stripsUtf8ByteOrderMark() {
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "name\nAcme\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);

        assertEquals(List.of("name"), parser.parse(content, null).headers());
    }

    @Test
    void fallsBackToWindows1252ForInvalidUtf8() {
        byte[] content = "name\nCafé\n".getBytes(Charset.forName("windows-1252"));

        assertEquals("Café", parser.parse(content, null).cell(0, 0));
    }

    @Test
    void rejectsEmptyInput() {
        MalformedImportException ex = assertThrows(MalformedImportException.class, () -> parser.parse(new byte[0], null));
        assertEquals("File is empty", ex.getMessage());

        assertThrows(MalformedImportException.class, () -> parser.parse("  \n ", null));
    }

    @Test
    void rejectsHeaderWithoutDataRows() {
        MalformedImportException ex = assertThrows(MalformedImportException.class, () -> parser.parse("a,b\n,\n", null));

        assertEquals("File has no data rows", ex.getMessage());
    }

    @Test
    void printedTableParsesBackToTheSameTable() throws IOException {
        ParsedTable original = new ParsedTable(
                List.of("Date", "Description", "Amount"),
                List.of(
                        List.of("2024-01-05", "Coffee, large", "-4.50"),
                        List.of("2024-01-06", "Quote \"inside\"", "12"),
                        List.of("2024-01-07", "two\nlines", "")
                )
        );

        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT)) {
            printer.printRecord(original.headers());
            for (List<String> row : original.rows()) {
                printer.printRecord(row);
            }
        }

        assertEquals(original, parser.parse(out.toString(), ','));
    }
}
