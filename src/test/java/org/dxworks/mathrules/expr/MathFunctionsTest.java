package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.rules.Definitions;
import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.XmlTreeReader;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MathFunctionsTest {

    private static final Definitions DEFINITIONS = new Definitions(Map.of(
            "SubsetOperators", List.of("⊂", "⊆"),
            "FunctionNames", List.of("sin", "log")));

    private static boolean bool(String expression, Node node) {
        EvalContext ctx = new EvalContext(node, null, DEFINITIONS, null);
        return CompiledExpression.compile(expression).evaluateBoolean(ctx);
    }

    private static String string(String expression, Node node) {
        EvalContext ctx = new EvalContext(node, null, DEFINITIONS, null);
        return CompiledExpression.compile(expression).evaluateString(ctx);
    }

    @Test
    void isBracketedMatchesLiteralParentheses() throws IOException {
        Node parens = XmlTreeReader.parse("<mrow><mo>(</mo><mi>a</mi><mo>)</mo></mrow>");

        assertTrue(bool("IsBracketed(., '(', ')')", parens));
        assertFalse(bool("IsBracketed(., '[', ')')", parens));
        assertFalse(bool("IsBracketed(., '(', ']')", parens));
        assertTrue(bool("IsBracketed(., '', ')')", parens));
    }

    @Test
    void isBracketedNeedsThreeChildrenAndOperatorTokens() throws IOException {
        Node four = XmlTreeReader.parse("<mrow><mo>(</mo><mi>a</mi><mi>b</mi><mo>)</mo></mrow>");
        Node identifiers = XmlTreeReader.parse("<mrow><mi>(</mi><mi>a</mi><mi>)</mi></mrow>");

        assertFalse(bool("IsBracketed(., '(', ')')", four));
        assertFalse(bool("IsBracketed(., '(', ')')", identifiers));
    }

    @Test
    void isNodeCategories() throws IOException {
        Node row = XmlTreeReader.parse("<mrow>"
                + "<mi>x</mi>"
                + "<mfrac><mn>1</mn><mn>2</mn></mfrac>"
                + "<mrow><mo>-</mo><mn>3</mn></mrow>"
                + "<msub><mi>a</mi><mn>1</mn></msub>"
                + "<mfrac><mi>a</mi><mn>2</mn></mfrac>"
                + "<mi>sin</mi>"
                + "</mrow>");

        assertTrue(bool("IsNode(*[1], 'leaf')", row));
        assertFalse(bool("IsNode(*[2], 'leaf')", row));
        assertTrue(bool("IsNode(*[1], 'simple') and IsNode(*[2], 'simple') and IsNode(*[3], 'simple')", row));
        assertTrue(bool("IsNode(*[4], 'simple')", row));
        assertFalse(bool("IsNode(*[5], 'simple')", row));
        assertTrue(bool("IsNode(*[2], 'common_fraction')", row));
        assertFalse(bool("IsNode(*[5], 'common_fraction')", row));
        assertTrue(bool("IsNode(*[6], 'trig_name')", row));
        assertTrue(bool("IsNode(*[6], 'FunctionNames')", row));
        assertFalse(bool("IsNode(*, 'leaf')", row));
        assertFalse(bool("IsNode(*[7], 'leaf')", row));
    }

    @Test
    void isNodeWithUnknownCategoryIsATypeError() throws IOException {
        Node mi = XmlTreeReader.parse("<mi>x</mi>");

        assertThrows(EvaluationTypeException.class, () -> bool("IsNode(., 'no-such-category')", mi));
    }

    @Test
    void isInDefinition() throws IOException {
        Node row = XmlTreeReader.parse("<mrow><mi>A</mi><mo>⊂</mo><mi>B</mi></mrow>");

        assertTrue(bool("IsInDefinition(*[2], 'SubsetOperators')", row));
        assertFalse(bool("IsInDefinition(*[1], 'SubsetOperators')", row));
        assertFalse(bool("IsInDefinition(., 'SubsetOperators')", row));
        assertFalse(bool("IsInDefinition(*[4], 'SubsetOperators')", row));
        assertTrue(bool("IsInDefinition('log', 'FunctionNames')", row));
        assertThrows(EvaluationTypeException.class, () -> bool("IsInDefinition(*[2], 'Unknown')", row));
    }

    @Test
    void isLargeOp() throws IOException {
        Node row = XmlTreeReader.parse("<mrow><mo>∑</mo><mo>+</mo><mi>∫</mi></mrow>");

        assertTrue(bool("IsLargeOp(*[1])", row));
        assertFalse(bool("IsLargeOp(*[2])", row));
        assertTrue(bool("IsLargeOp(*[3])", row));
    }

    @Test
    void baseNodeDescendsThroughScripts() throws IOException {
        Node sup = XmlTreeReader.parse("<msup><msub><mi>x</mi><mn>1</mn></msub><mn>2</mn></msup>");

        assertSame(sup.child(0).child(0), MathFunctions.baseNode(sup));
        assertEquals("x", string("BaseNode(.)", sup));
        assertTrue(bool("BaseNode(.)[self::m:mi]", sup));
        assertSame(sup.child(1), MathFunctions.baseNode(sup.child(1)));
    }

    @Test
    void ifThenElseEvaluatesOnlyTheTakenBranch() throws IOException {
        Node mi = XmlTreeReader.parse("<mi>x</mi>");

        assertEquals("yes", string("IfThenElse(text()='x', 'yes', $unbound)", mi));
        assertEquals("no", string("IfThenElse(text()='y', $unbound, 'no')", mi));
    }

    @Test
    void debugReturnsItsArgument() throws IOException {
        Node mi = XmlTreeReader.parse("<mi>x</mi>");

        assertEquals("x", string("DEBUG(text())", mi));
        assertTrue(bool("DEBUG(count(.) = 1)", mi));
    }

    @Test
    void nestingCharsCountsNestedFractionLevels() throws IOException {
        Node simple = XmlTreeReader.parse("<mfrac><mn>1</mn><mn>2</mn></mfrac>");
        Node complex = XmlTreeReader.parse(
                "<mfrac><mfrac><mn>1</mn><mn>2</mn></mfrac><mn>3</mn></mfrac>");

        assertEquals("", string("NestingChars(., '⠠')", simple));
        assertEquals("⠠", string("NestingChars(., '⠠')", complex));
    }

    @Test
    void brailleCharsUsesOneBasedInclusiveRange() throws IOException {
        Node mn = XmlTreeReader.parse("<mn>12345</mn>");

        assertEquals("12345", string("BrailleChars(., 'Nemeth')", mn));
        assertEquals("234", string("BrailleChars(., 'Nemeth', 2, string-length(.)-1)", mn));
    }
}
