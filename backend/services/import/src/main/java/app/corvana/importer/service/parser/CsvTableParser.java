package app.corvana.importer.service.parser;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class CsvTableParser {

    private static final char DEFAULT_DELIMITER = ',';
    private static final char[] DELIMITER_CANDIDATES = {',', ';', '\t', '|'};
    private static final Charset FALLBACK_CHARSET = Charset.forName("windows-1252");
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    public ParsedTable parse(byte[] content, Character delimiter) {
        if (content == null || content.length == 0) {
            throw new MalformedImportException("File is empty");
        }
        return parse(decode(content), delimiter);
    }

    public ParsedTable parse(String text, Character delimiter) {
        if (text == null || text.isBlank()) {
            throw new MalformedImportException("File is empty");
        }
        String body = text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        char resolved = delimiter != null ? delimiter : detectDelimiter(firstLine(body));

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(resolved)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();

        List<List<String>> records = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(body, format)) {
            for (CSVRecord record : parser) {
                records.add(recordToList(record));
            }
        } catch (IOException | UncheckedIOException ex) {
            throw new MalformedImportException("File could not be read as delimited text", ex);
        }

        if (records.isEmpty()) {
            throw new MalformedImportException("File is empty");
        }
        List<String> headers = records.get(0);
        List<List<String>> rows = new ArrayList<>();
        for (List<String> record : records.subList(1, records.size())) {
            if (isBlankRow(record)) {
                continue;
            }
            rows.add(fitToWidth(record, headers.size()));
        }
        if (rows.isEmpty()) {
            throw new MalformedImportException("File has no data rows");
        }
        return new ParsedTable(headers, rows);
    }

    String decode(byte[] content) {
        int offset = hasUtf8Bom(content) ? UTF8_BOM.length : 0;
        ByteBuffer buffer = ByteBuffer.wrap(content, offset, content.length - offset);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(buffer)
                    .toString();
        } catch (CharacterCodingException ex) {
            return new String(content, offset, content.length - offset, FALLBACK_CHARSET);
        }
    }

    char detectDelimiter(String headerLine) {
        char best = DEFAULT_DELIMITER;
        int bestCount = 0;
        for (char candidate : DELIMITER_CANDIDATES) {
            int count = countOutsideQuotes(headerLine, candidate);
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private int countOutsideQuotes(String line, char target) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == target && !quoted) {
                count++;
            }
        }
        return count;
    }

    private String firstLine(String text) {
        int end = 0;
        while (end < text.length() && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
            end++;
        }
        return text.substring(0, end);
    }

    private boolean hasUtf8Bom(byte[] content) {
        return content.length >= UTF8_BOM.length
                && content[0] == UTF8_BOM[0]
                && content[1] == UTF8_BOM[1]
                && content[2] == UTF8_BOM[2];
    }

    private List<String> recordToList(CSVRecord record) {
        List<String> values = new ArrayList<>(record.size());
        for (int i = 0; i < record.size(); i++) {
            String value = record.get(i);
            values.add(value == null ? "" : value);
        }
        return values;
    }

    private boolean isBlankRow(List<String> record) {
        for (String value : record) {
            if (!value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private List<String> fitToWidth(List<String> record, int width) {
        if (record.size() == width) {
            return record;
        }
        if (record.size() > width) {
            return new ArrayList<>(record.subList(0, width));
        }
        List<String> padded = new ArrayList<>(record);
        padded.addAll(Collections.nCopies(width - record.size(), ""));
        return padded;
    }
}
