package com.ortformat;

import java.io.IOException;
import java.nio.file.Path;

import com.ortformat.generator.OrtGenerator;
import com.ortformat.model.OrtValue;
import com.ortformat.parser.OrtParseException;
import com.ortformat.parser.OrtParser;
import com.ortformat.util.FileWriteUtil;

/**
 * Entry points for reading and writing ORT text.
 *
 * <pre>{@code
 * OrtValue users = Ort.parse("users:id,name:\n1,John\n2,Jane");
 * String name = users.get("users").get(0).get("name").asString().orElseThrow();
 * }</pre>
 */
public final class Ort {

    private static final OrtGenerator GENERATOR = new OrtGenerator();

    private Ort() {
    }

    /**
     * @throws OrtParseException if the text is not a well-formed ORT document
     */
    public static OrtValue parse(String text) {
        return new OrtParser(text).parse();
    }

    public static String generate(OrtValue value) {
        return GENERATOR.generate(value);
    }

    /**
     * Normalizes native data (maps, lists, arrays, strings, numbers, booleans, null) and
     * generates it.
     */
    public static String generate(Object value) {
        return GENERATOR.generate(OrtValue.of(value));
    }

    public static OrtValue load(Path path) throws IOException {
        return parse(FileWriteUtil.readString(path));
    }

    public static void dump(OrtValue value, Path path) throws IOException {
        FileWriteUtil.safeWriteString(path, generate(value));
    }

    public static void dump(Object value, Path path) throws IOException {
        dump(OrtValue.of(value), path);
    }
}
