package com.cellparser;

import com.cellparser.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ReferenceFinderTest {

    private static List<CellName> references(String source) {
        return ReferenceFinder.findReferences(CellParser.parseCell(source), DefaultGlobals.NAMES);
    }

    // viewof and mutable references are rendered with their modifier
    private static List<String> names(String source) {
        return references(source).stream()
            .map(name -> switch (name.kind()) {
                case PLAIN -> name.identifier().name();
                case VIEW -> "viewof " + name.identifier().name();
                case MUTABLE -> "mutable " + name.identifier().name();
            })
            .collect(Collectors.toList());
    }

    @Test
    void testFreeNames() {
        assertEquals(List.of("a", "b", "c"), names("a + b * c"));
    }

    @Test
    void testGlobalsAreNotReferences() {
        assertEquals(List.of("a", "b"), names("Math.max(a, b, Infinity, undefined)"));
        assertEquals(List.of(), names("window.document.title"));
    }

    @Test
    @DisplayName("A name read twice is listed twice")
    void testDuplicatesAreKept() {
        assertEquals(List.of("a", "a"), names("a * a"));
    }

    @Test
    void testPropertyNamesAreNotReferences() {
        assertEquals(List.of("o", "k"), names("o.p + ({q: 1})[k]"));
        assertEquals(List.of("x"), names("({x})"));
    }

    @Test
    void testBlockLocals() {
        assertEquals(List.of("b"), names("{ let a = 1; const [c, ...d] = [a]; return a + b + c + d.length; }"));
    }

    @Test
    void testVarIsHoistedToTheCell() {
        assertEquals(List.of(), names("{ if (true) { var v = 1; } return v; }"));
    }

    @Test
    void testLetStaysInItsBlock() {
        assertEquals(List.of("v"), names("{ if (true) { let v = 1; } return v; }"));
    }

    @Test
    void testFunctionScopes() {
        assertEquals(List.of("c"), names("function f(a, {b}) { return a + b + c + f.length + arguments.length; }"));
        assertEquals(List.of("y"), names("x => x + y"));
    }

    @Test
    void testFunctionDeclarationInBlock() {
        assertEquals(List.of(), names("{ function g() { return 1; } return g(); }"));
    }

    @Test
    void testClassNames() {
        assertEquals(List.of("Base"), names("class A extends Base { m() { return A; } }"));
        assertEquals(List.of(), names("{ class B {} return new B(); }"));
    }

    @Test
    void testCatchParameter() {
        assertEquals(List.of("risky"), names("{ try { risky(); } catch (e) { return e; } }"));
    }

    @Test
    void testForLoopBindings() {
        assertEquals(List.of("items"), names("{ for (const item of items) { item.done = true; } }"));
        assertEquals(List.of("n"), names("{ for (let i = 0; i < n; i++) {} }"));
    }

    @Test
    void testLabelsAreNotReferences() {
        assertEquals(List.of(), names("{ outer: for (;;) { break outer; } }"));
    }

    @Test
    @DisplayName("viewof and mutable references are reported as the wrapping node")
    void testModifiedReferences() {
        List<CellName> references = references("viewof x.value + mutable y");

        assertEquals(2, references.size());
        assertInstanceOf(ViewExpression.class, references.get(0));
        assertEquals("x", references.get(0).identifier().name());
        assertInstanceOf(MutableExpression.class, references.get(1));
        assertEquals(List.of("viewof x", "mutable y"), names("viewof x.value + mutable y"));
    }

    @Test
    void testMutableAssignmentIsAllowed() {
        assertEquals(List.of("mutable count"), names("{ mutable count = 2; }"));
        assertEquals(List.of("mutable count", "mutable count"), names("{ mutable count++; mutable count += 1; }"));
    }

    @Test
    void testCustomGlobals() {
        List<CellName> references = ReferenceFinder.findReferences(CellParser.parseCell("d3.select(Math)"), Set.of("d3"));

        assertEquals(1, references.size());
        assertEquals("Math", references.get(0).identifier().name());
    }

    @Test
    void testArgumentsOutsideFunction() {
        IllegalReferenceException e = assertThrows(IllegalReferenceException.class, () -> references("arguments[0]"));

        assertEquals("arguments is not allowed", e.getMessage());
        assertEquals(0, e.node().start());
    }

    @Test
    void testArgumentsInArrowFunction() {
        assertThrows(IllegalReferenceException.class, () -> references("() => arguments"));
    }

    @Test
    void testAssignmentToUndeclaredName() {
        IllegalReferenceException e = assertThrows(IllegalReferenceException.class, () -> references("{ x = 1; }"));

        assertEquals("Assignment to constant variable x", e.getMessage());
        assertEquals(2, e.node().start());
    }

    @Test
    void testAssignmentToGlobal() {
        IllegalReferenceException e = assertThrows(IllegalReferenceException.class, () -> references("{ Math = 1; }"));
        assertEquals("Assignment to constant variable Math", e.getMessage());
    }

    @Test
    void testOtherAssignmentForms() {
        assertThrows(IllegalReferenceException.class, () -> references("{ x++; }"));
        assertThrows(IllegalReferenceException.class, () -> references("{ [a, {b}] = pair; }"));
        assertThrows(IllegalReferenceException.class, () -> references("{ for (k in o) {} }"));
        assertThrows(IllegalReferenceException.class, () -> references("{ let a; ({a, b: [...c]} = o); }"));
    }

    @Test
    void testAssignmentToLocals() {
        assertEquals(List.of("o"), names("{ let a, b; [a, b] = [b, a]; a += 1; for (a of o) {} }"));
        assertEquals(List.of("o"), names("{ let n = 0; o.count = n++; }"));
    }

    @Test
    void testDefaultParameterValues() {
        assertEquals(List.of("fallback"), names("function f(a = fallback) { a = 2; return a; }"));
    }
}
