package com.ortformat.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ValueSplitter.
 */
class ValueSplitterTest {

    @Test
    void testSplitsOnTopLevelCommas() {
        assertThat(ValueSplitter.split("a,b,c")).containsExactly("a", "b", "c");
    }

    @Test
    void testKeepsGroupedCommas() {
        assertThat(ValueSplitter.split("1,(a,b),[x,(y,z)],2"))
                .containsExactly("1", "(a,b)", "[x,(y,z)]", "2");
    }

    @Test
    void testKeepsEmptyParts() {
        assertThat(ValueSplitter.split("")).containsExactly("");
        assertThat(ValueSplitter.split(",")).containsExactly("", "");
        assertThat(ValueSplitter.split("a,,b,")).containsExactly("a", "", "b", "");
    }

    @Test
    void testEscapedCharactersNeitherSplitNorNest() {
        assertThat(ValueSplitter.split("a\\,b,c")).containsExactly("a\\,b", "c");
        assertThat(ValueSplitter.split("\\(x,y")).containsExactly("\\(x", "y");
        assertThat(ValueSplitter.split("\\\\,z")).containsExactly("\\\\", "z");
    }

    @Test
    void testPreservesWhitespace() {
        assertThat(ValueSplitter.split(" a , b ")).containsExactly(" a ", " b ");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "key:value|3",
            "key\\:still:value|10",
            "no separator|-1",
            ":leading|0"
    })
    void testIndexOfKeySeparator(String pair, int expected) {
        assertThat(ValueSplitter.indexOfKeySeparator(pair)).isEqualTo(expected);
    }
}
