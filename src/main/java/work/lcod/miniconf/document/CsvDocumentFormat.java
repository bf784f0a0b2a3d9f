package work.lcod.miniconf.document;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.QuoteMode;
import work.lcod.miniconf.api.DataType;
import work.lcod.miniconf.api.Value;
import work.lcod.miniconf.shared.ValueParser;

/**
 * Flat {@code key,value} lines, one option per line, keys in dot-path form.
 *
 * <p>Text values are always written quoted. On read, a quoted value stays text; an unquoted one is
 * typed: integers, decimals, {@code true} and {@code false}, and text for everything else.
 */
public final class CsvDocumentFormat implements DocumentFormat {
    private static final Pattern INT = Pattern.compile("[+-]?\\d+");
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");
    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT
        .withCommentMarker('#')
        .withTrim(true);
    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.withRecordSeparator('\n');
    private static final CSVFormat TEXT_FORMAT = WRITE_FORMAT.withQuoteMode(QuoteMode.ALL);

    @Override
    public String name() {
        return "csv";
    }

    @Override
    public List<String> extensions() {
        return List.of("csv", "txt");
    }

    @Override
    public DocumentTree read(String text) {
        Map<String, Value> flat = new LinkedHashMap<>();
        List<String> ignored = new ArrayList<>();
        try (CSVParser parser = new CSVParser(new StringReader(text), READ_FORMAT)) {
            for (CSVRecord record : parser) {
                String key = record.get(0);
                if (key.isEmpty()) {
                    continue;
                }
                if (record.size() != 2) {
                    ignored.add(key);
                    continue;
                }
                String raw = record.get(1);
                boolean quoted = valueIsQuoted(text, (int) record.getCharacterPosition());
                flat.put(key, quoted ? Value.of(raw) : infer(raw));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new DocumentException("csv parse error: " + ex.getMessage(), ex);
        }
        var tree = DocumentTree.unflatten(flat);
        return new DocumentTree(tree.root(), ignored);
    }

    @Override
    public String write(DocumentTree tree) {
        var out = new StringBuilder();
        try {
            for (var entry : tree.flatten().entrySet()) {
                Value value = entry.getValue();
                out.append(WRITE_FORMAT.format(entry.getKey())).append(WRITE_FORMAT.getDelimiterString());
                if (value.type() == DataType.TEXT) {
                    out.append(TEXT_FORMAT.format(value.getText()));
                } else {
                    out.append(WRITE_FORMAT.format(ValueParser.plainText(value)));
                }
                out.append('\n');
            }
        } catch (UncheckedIOException | IllegalStateException ex) {
            throw new DocumentException("Unable to write csv document: " + ex.getMessage(), ex);
        }
        return out.toString();
    }

    /**
     * Tells whether the second field of the record starting at {@code start} opens with a quote.
     * Blank and comment lines the parser skipped before the record are skipped here as well.
     */
    static boolean valueIsQuoted(String text, int start) {
        int i = start;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\r' || c == '\n') {
                i++;
            } else if (c == '#') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
            } else {
                break;
            }
        }
        if (i < text.length() && text.charAt(i) == '"') {
            i++;
            while (i < text.length()) {
                if (text.charAt(i++) == '"') {
                    if (i < text.length() && text.charAt(i) == '"') {
                        i++;
                    } else {
                        break;
                    }
                }
            }
        }
        while (i < text.length() && text.charAt(i) != ',' && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
            i++;
        }
        return i + 1 < text.length() && text.charAt(i) == ',' && text.charAt(i + 1) == '"';
    }

    static Value infer(String raw) {
        if (INT.matcher(raw).matches()) {
            try {
                return Value.of(Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return Value.of(Double.parseDouble(raw));
            }
        }
        if (NUMBER.matcher(raw).matches()) {
            return Value.of(Double.parseDouble(raw));
        }
        if ("true".equals(raw) || "false".equals(raw)) {
            return Value.of(Boolean.parseBoolean(raw));
        }
        return Value.of(raw);
    }
}
