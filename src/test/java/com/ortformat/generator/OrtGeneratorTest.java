package com.ortformat.generator;

import com.ortformat.model.OrtValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OrtGenerator, HeaderLayout and LiteralWriter.
 */
class OrtGeneratorTest {

    private final OrtGenerator generator = new OrtGenerator();

    @Test
    void testMultipleSectionsAreSeparatedByBlankLines() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("a", 1);
        doc.put("b", List.of(record("x", 1, "y", 2), record("x", 3, "y", 4)));

        assertThat(generate(doc)).isEqualTo("a:\n1\n\nb:x,y:\n1,2\n3,4\n");
    }

    @Test
    void testSingleKeyObjectIsOneSection() {
        assertThat(generate(Map.of("users", List.of(record("id", 1, "name", "John")))))
                .isEqualTo("users:id,name:\n1,John");
        assertThat(generate(Map.of("tags", List.of("a", "b")))).isEqualTo("tags:\n[a,b]");
    }

    @Test
    void testEmptyObjectGeneratesNothing() {
        assertThat(generator.generate(OrtValue.emptyObject())).isEmpty();
    }

    @Test
    void testNestedObjectsBecomeGroupedColumns() {
        Map<String, Object> alice = record("name", "Alice",
                "addr", record("street", "Main St", "city", "NYC"));
        Map<String, Object> bob = record("name", "Bob",
                "addr", record("street", "Elm St", "city", "LA"));

        assertThat(generate(Map.of("people", List.of(alice, bob))))
                .isEqualTo("people:name,addr(street,city):\n"
                        + "Alice,(Main St,NYC)\n"
                        + "Bob,(Elm St,LA)");
    }

    @Test
    void testRowsFollowFirstRecordKeyOrder() {
        List<Object> rows = List.of(record("a", 1, "b", 2), record("b", 4, "a", 3));

        assertThat(generate(Map.of("t", rows))).isEqualTo("t:a,b:\n1,2\n3,4");
    }

    @Test
    void testNonUniformArraysUseLiteralForm() {
        List<Object> mixed = List.of(record("a", 1), record("b", 2));

        assertThat(generate(Map.of("t", mixed))).isEqualTo("t:\n[(a:1),(b:2)]");
        assertThat(generate(Map.of("t", List.of(Map.of(), Map.of())))).isEqualTo("t:\n[(),()]");
        assertThat(generate(Map.of("t", List.of()))).isEqualTo("t:\n[]");
    }

    @Test
    void testTopLevelArrays() {
        assertThat(generate(List.of(record("id", 1), record("id", 2)))).isEqualTo(":id:\n1\n2");
        assertThat(generate(List.of(1, "a", true))).isEqualTo(":[1,a,true]");
        assertThat(generate(List.of())).isEqualTo(":[]");
    }

    @Test
    void testTopLevelScalars() {
        assertThat(generator.generate(OrtValue.of(42))).isEqualTo("42");
        assertThat(generator.generate(OrtValue.of("hi"))).isEqualTo("hi");
        assertThat(generator.generate(OrtValue.ofNull())).isEmpty();
    }

    @Test
    void testNullCellsAreEmpty() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("a", null);
        row.put("b", 1);
        row.put("c", null);

        assertThat(generate(Map.of("t", List.of(row)))).isEqualTo("t:a,b,c:\n,1,");
    }

    @Test
    void testObjectInPlainColumnIsWrittenInline() {
        List<Object> rows = List.of(
                record("id", 1, "meta", "none"),
                record("id", 2, "meta", record("k", "v")));

        assertThat(generate(Map.of("t", rows))).isEqualTo("t:id,meta:\n1,none\n2,(k:v)");
    }

    @Test
    void testNestedColumnNeedsOneKeySetAcrossRecords() {
        List<Object> rows = List.of(
                record("id", 1, "addr", record("city", "NYC")),
                record("id", 2, "addr", record("zip", 10001)));

        assertThat(generate(Map.of("t", rows))).isEqualTo("t:id,addr:\n1,(city:NYC)\n2,(zip:10001)");
    }

    @Test
    void testNestedColumnAllowsNullAndEmptyCells() {
        List<Object> rows = new ArrayList<>();
        rows.add(record("id", 1, "geo", record("lat", 1, "lon", 2)));
        rows.add(record("id", 2, "geo", null));
        rows.add(record("id", 3, "geo", Map.of()));
        rows.add(record("id", 4, "geo", record("lon", 5, "lat", 6)));

        assertThat(generate(Map.of("t", rows))).isEqualTo("t:id,geo(lat,lon):\n1,(1,2)\n2,\n3,()\n4,(6,5)");
    }

    @Test
    void testNestedGroupsAreCheckedAtEveryDepth() {
        List<Object> rows = List.of(
                record("id", 1, "who", record("name", "A", "geo", record("lat", 1))),
                record("id", 2, "who", record("name", "B", "geo", record("lon", 2))));

        assertThat(generate(Map.of("t", rows)))
                .isEqualTo("t:id,who(name,geo):\n1,(A,(lat:1))\n2,(B,(lon:2))");
    }

    @Test
    void testInlineObjectKeysAreEscaped() {
        Map<String, Object> keys = record("a,b", 1, "x:y", 2, "(p)", List.of());

        assertThat(generate(Map.of("c", keys))).isEqualTo("c:\n(a\\,b:1,x\\:y:2,\\(p\\):[])");
    }

    @Test
    void testEmptyNestedObjectIsLeafColumn() {
        List<Object> rows = List.of(record("id", 1, "meta", Map.of()));

        assertThat(generate(Map.of("t", rows))).isEqualTo("t:id,meta:\n1,()");
    }

    @Test
    void testStringsAreEscaped() {
        assertThat(generate(Map.of("t", List.of(record("text", "a,b\nc")))))
                .isEqualTo("t:text:\na\\,b\\nc");
        assertThat(generate(Map.of("s", "f(x)"))).isEqualTo("s:\nf\\(x\\)");
    }

    @Test
    void testInlineObjectLiteral() {
        Map<String, Object> config = record("host", "localhost", "ports", List.of(80, 443), "tls", record("on", true));

        assertThat(generate(Map.of("config", config)))
                .isEqualTo("config:\n(host:localhost,ports:[80,443],tls:(on:true))");
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, 1",
            "-0.0, -0",
            "0.0, 0",
            "-3.0, -3",
            "2.5, 2.5",
            "0.1, 0.1",
            "1e20, 1.0E20",
            "123456789012.0, 123456789012",
            "NaN, NaN",
            "Infinity, Infinity",
            "-Infinity, -Infinity"
    })
    void testNumberFormatting(double input, String expected) {
        assertThat(LiteralWriter.formatNumber(input)).isEqualTo(expected);
    }

    @Test
    void testHeaderLayoutFromSingleRecord() {
        OrtValue first = OrtValue.of(record("id", 1, "who", record("name", "A", "geo", record("lat", 1, "lon", 2))));

        HeaderLayout layout = HeaderLayout.fromRecords(List.of(first));

        assertThat(layout.header()).isEqualTo("id,who(name,geo(lat,lon))");
        assertThat(layout.row(first)).isEqualTo("1,(A,(1,2))");
    }

    @Test
    void testUniformObjectArrayDetection() {
        assertThat(HeaderLayout.isUniformObjectArray(List.of())).isFalse();
        assertThat(HeaderLayout.isUniformObjectArray(List.of(OrtValue.of(record("a", 1)), OrtValue.of(record("a", 2)))))
                .isTrue();
        assertThat(HeaderLayout.isUniformObjectArray(List.of(OrtValue.of(record("a", 1)), OrtValue.of(1))))
                .isFalse();
        assertThat(HeaderLayout.isUniformObjectArray(List.of(OrtValue.emptyObject()))).isFalse();
    }

    private String generate(Object value) {
        return generator.generate(OrtValue.of(value));
    }

    private static Map<String, Object> record(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
