package com.ortformat.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ortformat.model.Field;
import com.ortformat.model.OrtValue;

/**
 * Parser for ORT documents.
 *
 * <p>A document is a sequence of sections, each a header line followed by the data lines
 * up to the next header. Named sections ({@code key:fields:} and {@code key:}) are
 * collected into one top-level object in document order. The first anonymous section
 * ({@code :fields:}) ends the scan and its value becomes the whole result.
 *
 * <p>Instances are single-use and not thread-safe; create one per document.
 */
public class OrtParser {
    private static final Logger log = LoggerFactory.getLogger(OrtParser.class);

    private final List<OrtLine> lines;
    private final HeaderParser headerParser = new HeaderParser();
    private final ValueParser valueParser = new ValueParser();
    private int pos = 0;

    public OrtParser(String source) {
        this.lines = new OrtScanner(source).scan();
    }

    /**
     * @throws OrtParseException on the first malformed header, arity mismatch or
     *                           unbalanced field group
     */
    public OrtValue parse() {
        if (isBareValue()) {
            OrtLine only = lines.get(0);
            log.debug("Parsing bare value at line {}", only.getNumber());
            return valueParser.parseValue(only.getContent(), only);
        }

        Map<String, OrtValue> result = new LinkedHashMap<>();

        while (!isAtEnd()) {
            OrtHeader header = headerParser.parse(advance());
            List<OrtLine> dataLines = collectDataLines();

            if (header.isAnonymous()) {
                log.debug("Anonymous section at line {} with {} data lines",
                        header.getLine().getNumber(), dataLines.size());
                return parseAnonymousSection(header, dataLines);
            }

            log.debug("Section '{}' at line {} with {} fields and {} data lines", header.getKey(),
                    header.getLine().getNumber(), header.getFields().size(), dataLines.size());
            result.put(header.getKey(), parseNamedSection(header, dataLines));
        }

        return OrtValue.of(result);
    }

    private OrtValue parseAnonymousSection(OrtHeader header, List<OrtLine> dataLines) {
        if (header.hasLiteral()) {
            return valueParser.parseValue(header.getLiteral(), header.getLine());
        }
        if (!header.hasFields()) {
            return parseSingleValue(header, dataLines);
        }

        List<OrtValue> records = parseRecords(header.getFields(), dataLines);
        if (records.size() == 1) {
            return records.get(0);
        }
        return OrtValue.of(records);
    }

    private OrtValue parseNamedSection(OrtHeader header, List<OrtLine> dataLines) {
        if (!header.hasFields()) {
            return parseSingleValue(header, dataLines);
        }
        return OrtValue.of(parseRecords(header.getFields(), dataLines));
    }

    /**
     * Only the first data line of a section without fields is read; any further lines
     * belonging to the section are ignored.
     */
    private OrtValue parseSingleValue(OrtHeader header, List<OrtLine> dataLines) {
        if (dataLines.isEmpty()) {
            return OrtValue.ofNull();
        }
        if (dataLines.size() > 1) {
            log.debug("Ignoring {} extra data lines after line {} in single-value section",
                    dataLines.size() - 1, dataLines.get(0).getNumber());
        }
        OrtLine first = dataLines.get(0);
        return valueParser.parseValue(first.getContent(), first);
    }

    private List<OrtValue> parseRecords(List<Field> fields, List<OrtLine> dataLines) {
        List<OrtValue> records = new ArrayList<>(dataLines.size());
        for (OrtLine line : dataLines) {
            List<String> parts = ValueSplitter.split(line.getContent());
            if (parts.size() != fields.size()) {
                throw OrtParseException.arity(line, fields.size(), parts.size(), false);
            }
            records.add(valueParser.record(fields, parts, line));
        }
        return records;
    }

    private List<OrtLine> collectDataLines() {
        List<OrtLine> dataLines = new ArrayList<>();
        while (!isAtEnd() && !peek().isHeader()) {
            dataLines.add(advance());
        }
        return dataLines;
    }

    /**
     * A document consisting of one line that is neither a header nor colon-bearing holds
     * a single bare value. Any other non-header line in header position is malformed.
     */
    private boolean isBareValue() {
        if (lines.size() != 1) {
            return false;
        }
        String content = lines.get(0).getContent();
        return !OrtLine.isHeader(content) && content.indexOf(':') < 0;
    }

    private boolean isAtEnd() {
        return pos >= lines.size();
    }

    private OrtLine peek() {
        return lines.get(pos);
    }

    private OrtLine advance() {
        return lines.get(pos++);
    }
}
