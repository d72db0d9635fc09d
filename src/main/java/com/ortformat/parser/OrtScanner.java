package com.ortformat.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a document into its significant lines. Blank lines and lines whose first
 * non-whitespace character is {@code #} are dropped; numbering still counts them.
 */
public class OrtScanner {

    private final String source;

    public OrtScanner(String source) {
        this.source = source;
    }

    public List<OrtLine> scan() {
        List<OrtLine> lines = new ArrayList<>();
        String[] rawLines = source.split("\n", -1);

        for (int i = 0; i < rawLines.length; i++) {
            String raw = rawLines[i];
            if (raw.endsWith("\r")) {
                raw = raw.substring(0, raw.length() - 1);
            }

            String content = raw.strip();
            if (content.isEmpty() || content.startsWith("#")) {
                continue;
            }

            lines.add(new OrtLine(i + 1, raw, content, raw.indexOf(content)));
        }

        return lines;
    }
}
