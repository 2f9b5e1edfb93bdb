package org.dxworks.mathrules.expr;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LexerTest {

    private static List<ExprTokenType> types(String source) {
        return new Lexer(source).tokenize().stream().map(t -> t.type).collect(Collectors.toList());
    }

    @Test
    void starIsANameTestAtTheStartAndMultiplicationAfterAnOperand() {
        assertEquals(List.of(ExprTokenType.STAR, ExprTokenType.LBRACKET, ExprTokenType.NUMBER,
                ExprTokenType.RBRACKET, ExprTokenType.EOF), types("*[1]"));
        assertEquals(List.of(ExprTokenType.NUMBER, ExprTokenType.MULTIPLY, ExprTokenType.VARIABLE,
                ExprTokenType.EOF), types("2 * $n"));
    }

    @Test
    void operatorNamesDependOnPosition() {
        assertEquals(List.of(ExprTokenType.NAME, ExprTokenType.DOUBLE_COLON, ExprTokenType.NAME,
                ExprTokenType.AND, ExprTokenType.NAME, ExprTokenType.LPAREN, ExprTokenType.RPAREN,
                ExprTokenType.EOF), types("self::m:mo and text()"));
        assertEquals(List.of(ExprTokenType.NAME, ExprTokenType.EOF), types("div"));
    }

    @Test
    void namesKeepHyphensAndCombinePrefixes() {
        List<ExprToken> tokens = new Lexer("following-sibling::m:mn").tokenize();

        assertEquals("following-sibling", tokens.get(0).text);
        assertEquals("m:mn", tokens.get(2).text);
    }

    @Test
    void literalsAndVariables() {
        List<ExprToken> tokens = new Lexer("concat($NewScriptContext, '⠘', \"'\")").tokenize();

        assertEquals(ExprTokenType.VARIABLE, tokens.get(2).type);
        assertEquals("NewScriptContext", tokens.get(2).text);
        assertEquals("⠘", tokens.get(4).text);
        assertEquals("'", tokens.get(6).text);
    }

    @Test
    void dotsAndParentSteps() {
        assertEquals(List.of(ExprTokenType.DOUBLE_DOT, ExprTokenType.SLASH, ExprTokenType.DOUBLE_DOT,
                ExprTokenType.SLASH, ExprTokenType.NAME, ExprTokenType.DOUBLE_COLON, ExprTokenType.NAME,
                ExprTokenType.EOF), types("../../self::m:set"));
        assertEquals(List.of(ExprTokenType.NAME, ExprTokenType.LPAREN, ExprTokenType.DOT,
                ExprTokenType.COMMA, ExprTokenType.LITERAL, ExprTokenType.RPAREN, ExprTokenType.EOF),
                types("IsNode(., 'simple')"));
    }

    @Test
    void unterminatedLiteralIsASyntaxError() {
        assertThrows(ExpressionSyntaxException.class, () -> new Lexer("text()='x").tokenize());
    }
}
