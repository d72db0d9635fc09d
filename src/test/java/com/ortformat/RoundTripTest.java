package com.ortformat;

import com.ortformat.model.OrtValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Generate-then-parse tests through the Ort facade.
 */
class RoundTripTest {

    @TempDir
    Path tempDir;

    static Stream<Object> documents() {
        Map<String, Object> mixed = new LinkedHashMap<>();
        mixed.put("users", List.of(record("id", 1, "name", "John"), record("id", 2, "name", "Jane")));
        mixed.put("settings", record("debug", true, "level", 3));
        mixed.put("tags", List.of("a", "b"));

        Map<String, Object> people = new LinkedHashMap<>();
        people.put("people", List.of(
                record("name", "Alice", "addr", record("street", "Main St", "geo", record("lat", 40.7, "lon", -74))),
                record("name", "Bob", "addr", record("street", "Elm St", "geo", record("lat", 34.05, "lon", -118.25)))));

        Map<String, Object> escapes = Map.of("t", List.of(
                record("text", "a,b\nc", "path", "f(x)[0]"),
                record("text", "tab\there", "path", "C:\\dir")));

        List<Object> withNulls = new ArrayList<>();
        withNulls.add(record("a", null, "b", 1));
        withNulls.add(record("a", 2, "b", null));

        Map<String, Object> emptySections = new LinkedHashMap<>();
        emptySections.put("a", List.of());
        emptySections.put("b", Map.of());
        emptySections.put("c", null);
        emptySections.put("d", "last");

        Map<String, Object> cells = Map.of("rows", List.of(
                record("id", 1, "tags", List.of("x", "y"), "meta", record("k", "v")),
                record("id", 2, "tags", List.of(), "meta", record("k", "w"))));

        Map<String, Object> mixedNestedKeys = Map.of("rows", List.of(
                record("id", 1, "addr", record("city", "NYC")),
                record("id", 2, "addr", record("zip", 10001))));

        List<Object> sparseNested = new ArrayList<>();
        sparseNested.add(record("id", 1, "geo", record("lat", 1, "lon", 2)));
        sparseNested.add(record("id", 2, "geo", null));
        sparseNested.add(record("id", 3, "geo", Map.of()));
        sparseNested.add(record("id", 4, "geo", record("lon", 5, "lat", 6)));

        Map<String, Object> awkwardKeys = new LinkedHashMap<>();
        awkwardKeys.put("a,b", 1);
        awkwardKeys.put("x:y", 2);
        awkwardKeys.put("(p)[q]", List.of(1));
        awkwardKeys.put("back\\slash", record("in:ner", "v"));

        return Stream.of(
                mixed,
                mixedNestedKeys,
                Map.of("rows", sparseNested),
                Map.of("c", awkwardKeys),
                Map.of("z", -0.0),
                -0.0,
                people,
                escapes,
                Map.of("rows", withNulls),
                emptySections,
                cells,
                Map.of("matrix", List.of(List.of(1, 2), List.of(3, 4))),
                List.of(record("id", 1, "ok", true), record("id", 2, "ok", false)),
                List.of(1, "a", List.of(2, 3), record("k", "v")),
                List.of(),
                42,
                -0.5,
                "hello world",
                true);
    }

    @ParameterizedTest
    @MethodSource("documents")
    void testParseInvertsGenerate(Object document) {
        OrtValue value = OrtValue.of(document);

        String text = Ort.generate(value);

        assertThat(Ort.parse(text)).isEqualTo(value);
    }

    @ParameterizedTest
    @MethodSource("documents")
    void testGeneratedTextIsStable(Object document) {
        String text = Ort.generate(document);

        assertThat(Ort.generate(Ort.parse(text))).isEqualTo(text);
    }

    @Test
    void testDocumentLevelExample() {
        String text = """
                users:id,name,address(street,city):
                1,John,(123 Main St,NYC)
                2,Jane,(456 Oak Ave,LA)

                config:
                (env:prod,replicas:3)
                """;

        OrtValue value = Ort.parse(text);

        assertThat(value.get("users").get(1).get("address").get("city").asString()).contains("LA");
        assertThat(Ort.generate(value)).isEqualTo(text);
    }

    @Test
    void testDumpAndLoad() throws IOException {
        Path file = tempDir.resolve("nested/dir/data.ort");
        Map<String, Object> data = Map.of("users", List.of(record("id", 1, "name", "Zoë"), record("id", 2, "name", "Łukasz")));

        Ort.dump(data, file);

        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("Zoë");
        assertThat(Ort.load(file)).isEqualTo(OrtValue.of(data));
    }

    private static Map<String, Object> record(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
