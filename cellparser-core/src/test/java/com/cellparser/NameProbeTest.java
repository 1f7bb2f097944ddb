package com.cellparser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class NameProbeTest {

    @Test
    void testNamedCell() {
        assertEquals(Optional.of("x"), NameProbe.peekId("x = 1"));
        assertEquals(Optional.of("total"), NameProbe.peekId("total = a + b"));
    }

    @Test
    void testModifiers() {
        assertEquals(Optional.of("x"), NameProbe.peekId("viewof x = slider()"));
        assertEquals(Optional.of("count"), NameProbe.peekId("mutable count = 0"));
    }

    @Test
    void testFunctionsAndClasses() {
        assertEquals(Optional.of("f"), NameProbe.peekId("function f() {}"));
        assertEquals(Optional.of("g"), NameProbe.peekId("function* g() { yield 1; }"));
        assertEquals(Optional.of("h"), NameProbe.peekId("async function h() {}"));
        assertEquals(Optional.of("Point"), NameProbe.peekId("class Point {}"));
    }

    @Test
    @DisplayName("A name only counts as a declaration when '=' follows it")
    void testExpressionHasNoName() {
        assertEquals(Optional.empty(), NameProbe.peekId("1 + 2"));
        assertEquals(Optional.empty(), NameProbe.peekId("x + 1"));
        assertEquals(Optional.empty(), NameProbe.peekId("x == 1"));
        assertEquals(Optional.empty(), NameProbe.peekId("{ x = 1 }"));
        assertEquals(Optional.empty(), NameProbe.peekId("import {a} from \"m\""));
    }

    @Test
    @DisplayName("A function name at the very end of the input is not accepted")
    void testTrailingFunctionName() {
        assertEquals(Optional.empty(), NameProbe.peekId("function f"));
        assertEquals(Optional.empty(), NameProbe.peekId("function"));
        assertEquals(Optional.of("f"), NameProbe.peekId("function f("));
    }

    @Test
    void testIncompleteInput() {
        assertEquals(Optional.of("x"), NameProbe.peekId("x ="));
        assertEquals(Optional.of("x"), NameProbe.peekId("x = {"));
        assertEquals(Optional.empty(), NameProbe.peekId("viewof"));
        assertEquals(Optional.empty(), NameProbe.peekId("x"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "'unterminated", "`open ${", "x = \"abc", "/* never closed", "#", "1..2", "@",
        "x 1\u0663", "function 0\u0669", "x = 0x\uFF11", "'\\x\u0661\u0662'"})
    @DisplayName("Never throws, whatever the input")
    void testNeverThrows(String input) {
        assertDoesNotThrow(() -> NameProbe.peekId(input));
    }

    @Test
    void testTokenizerFailureMeansNoName() {
        assertEquals(Optional.empty(), NameProbe.peekId("'unterminated"));
        assertEquals(Optional.empty(), NameProbe.peekId(""));
        assertEquals(Optional.empty(), NameProbe.peekId("x 1\u0663"));
        assertEquals(Optional.empty(), NameProbe.peekId("function 0\u0669"));
    }
}
