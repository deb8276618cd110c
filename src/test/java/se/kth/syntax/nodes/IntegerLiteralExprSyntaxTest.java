package se.kth.syntax.nodes;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import se.kth.syntax.exception.ShapeViolationException;
import se.kth.syntax.raw.TokenKind;

class IntegerLiteralExprSyntaxTest {

    @Test
    void withSign_shouldPrecedeDigits() {
        IntegerLiteralExprSyntax literal = IntegerLiteralExprSyntax.makeBlank()
                .withSign(SyntaxFactory.makePrefixOperator("-", "", ""))
                .withDigits(SyntaxFactory.makeIntegerLiteral("42", "", ""));

        assertEquals("-42", literal.print());
        assertEquals("-", literal.getSign().getText());
        assertEquals("42", literal.getDigits().getText());
        assertTrue(literal.getSign().isPresent());
    }

    @Test
    void getSign_shouldBeMissing_whenOnlyDigitsAreSet() {
        IntegerLiteralExprSyntax literal = SyntaxFactory.makeIntegerLiteralExpr(
                SyntaxFactory.makeMissingToken(TokenKind.OPER_PREFIX),
                SyntaxFactory.makeIntegerLiteral("7", " ", ""));

        assertTrue(literal.getSign().isMissing());
        assertEquals(" 7", literal.print());
    }

    @Test
    void withDigits_shouldLeaveEarlierVersionUntouched() {
        IntegerLiteralExprSyntax one = IntegerLiteralExprSyntax.makeBlank()
                .withDigits(SyntaxFactory.makeIntegerLiteral("1", "", ""));

        IntegerLiteralExprSyntax two = one.withDigits(SyntaxFactory.makeIntegerLiteral("2", "", ""));

        assertEquals("1", one.print());
        assertEquals("2", two.print());
        assertSame(one.getRaw().getChild(0), two.getRaw().getChild(0));
    }

    @Test
    void withDigits_shouldThrow_whenTokenIsNotIntegerLiteral() {
        IntegerLiteralExprSyntax literal = IntegerLiteralExprSyntax.makeBlank();

        assertThrows(ShapeViolationException.class,
                () -> literal.withDigits(SyntaxFactory.makeIdentifier("x", "", "")));
    }

    @Test
    void getTextPosition_shouldSkipLeadingTrivia() {
        IntegerLiteralExprSyntax literal = IntegerLiteralExprSyntax.makeBlank()
                .withSign(SyntaxFactory.makePrefixOperator("-", "\n  ", ""))
                .withDigits(SyntaxFactory.makeIntegerLiteral("42", "", ""));

        TokenSyntax digits = literal.getDigits();

        assertEquals(4, digits.getAbsolutePosition().getOffset());
        assertEquals("2:4", digits.getTextPosition().toString());
        assertEquals("2:3", literal.getSign().getTextPosition().toString());
    }
}
