package se.kth.syntax.data;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import se.kth.syntax.Util;
import se.kth.syntax.nodes.FunctionCallExprSyntax;
import se.kth.syntax.raw.AbsolutePosition;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.raw.TokenKind;

class SyntaxDataTest {

    @Test
    void getChild_shouldReturnSameContext_whenAskedTwice() {
        SyntaxData root = Util.makeFooCall().getData();

        SyntaxData first = root.getChild(2);
        SyntaxData second = root.getChild(2);

        assertSame(first, second);
        assertSame(root, first.getParent().get());
        assertSame(root, first.getRoot());
        assertEquals(2, first.getIndexInParent());
    }

    @Test
    void getChild_shouldThrow_whenIndexIsOutOfRange() {
        SyntaxData root = Util.makeFooCall().getData();

        assertThrows(IndexOutOfBoundsException.class, () -> root.getChild(4));
    }

    @Test
    void siblings_shouldFollowLayoutOrder() {
        SyntaxData root = Util.makeFooCall().getData();
        SyntaxData leftParen = root.getChild(1);

        assertSame(root.getChild(0), leftParen.getPreviousSibling().get());
        assertSame(root.getChild(2), leftParen.getNextSibling().get());
        assertFalse(root.getChild(0).getPreviousSibling().isPresent());
        assertFalse(root.getChild(3).getNextSibling().isPresent());
        assertFalse(root.getNextSibling().isPresent());
    }

    @Test
    void getAbsolutePosition_shouldAccountForEverythingPrintedBefore() {
        // foo(x: 1,)
        SyntaxData root = Util.makeFooCall().getData();
        SyntaxData argument = root.getChild(2).getChild(0);
        SyntaxData expression = argument.getChild(2);
        SyntaxData rightParen = root.getChild(3);

        assertEquals(AbsolutePosition.start(), root.getAbsolutePosition());
        assertEquals(new AbsolutePosition(4, 1, 5), argument.getAbsolutePosition());
        assertEquals(new AbsolutePosition(7, 1, 8), expression.getAbsolutePosition());
        assertEquals(new AbsolutePosition(9, 1, 10), rightParen.getAbsolutePosition());
        assertEquals(new AbsolutePosition(10, 1, 11), root.getEndPosition());
    }

    @Test
    void getAbsolutePosition_shouldCountCrLfOnce_whenSplitBetweenTokens() {
        RawSyntax pair = RawSyntax.make(
                SyntaxKind.UNKNOWN_EXPR,
                List.of(RawTokenSyntax.make(TokenKind.IDENTIFIER, "a", SourcePresence.PRESENT, "", "\r"),
                        RawTokenSyntax.make(TokenKind.IDENTIFIER, "b", SourcePresence.PRESENT, "\n", "")),
                SourcePresence.PRESENT);
        SyntaxData b = SyntaxData.make(pair).getChild(1);

        AbsolutePosition textOfB = b.getAbsolutePosition().advancedBy("\n");

        assertEquals(new AbsolutePosition(3, 2, 1), textOfB);
        assertEquals(AbsolutePosition.start().advancedBy(pair.print()), b.getEndPosition());
    }

    @Test
    void substitute_shouldKeepPlaceInTree_withoutEditingIt() {
        SyntaxData callee = Util.makeFooCall().getData().getChild(0);
        RawSyntax other = RawTokenSyntax.make(TokenKind.IDENTIFIER, "bar");

        SyntaxData standIn = callee.substitute(other);

        assertSame(other, standIn.getRaw());
        assertSame(callee.getParent().get(), standIn.getParent().get());
        assertEquals(callee.getIndexInParent(), standIn.getIndexInParent());
        assertEquals("foo(x: 1,)", standIn.getRoot().getRaw().print());
    }

    @Test
    void replaceChild_shouldRebuildOneNodePerAncestor_andShareSiblings() {
        SyntaxData root = Util.makeFooCall().getData();
        SyntaxData argument = root.getChild(2).getChild(0);
        RawTokenSyntax label = RawTokenSyntax.make(TokenKind.IDENTIFIER, "y");

        SyntaxData edited = argument.replaceChild(0, label);
        SyntaxData newRoot = edited.getRoot();

        assertEquals("foo(x: 1,)", root.getRaw().print());
        assertEquals("foo(y: 1,)", newRoot.getRaw().print());
        assertNotSame(root.getRaw(), newRoot.getRaw());
        assertNotSame(root.getRaw().getChild(2), newRoot.getRaw().getChild(2));
        assertSame(root.getRaw().getChild(0), newRoot.getRaw().getChild(0));
        assertSame(root.getRaw().getChild(1), newRoot.getRaw().getChild(1));
        assertSame(root.getRaw().getChild(3), newRoot.getRaw().getChild(3));
        assertSame(argument.getRaw().getChild(2), edited.getRaw().getChild(2));
        assertSame(label, edited.getRaw().getChild(0));
        assertEquals(2, edited.getParent().get().getIndexInParent());
    }

    @Test
    void replaceSelf_shouldMakeNewRoot_whenContextIsRoot() {
        SyntaxData root = SyntaxData.make(RawTokenSyntax.make(TokenKind.IDENTIFIER, "a"));
        RawSyntax replacement = RawTokenSyntax.make(TokenKind.IDENTIFIER, "b");

        SyntaxData replaced = root.replaceSelf(replacement);

        assertTrue(replaced.isRoot());
        assertSame(replacement, replaced.getRaw());
        assertEquals("a", root.getRaw().print());
    }

    @Test
    void getChild_shouldHandOutOneContext_underConcurrentReads() throws Exception {
        FunctionCallExprSyntax call = Util.makeFooCall();
        SyntaxData root = call.getData();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<SyntaxData>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> {
                    SyntaxData expression = root.getChild(2).getChild(0).getChild(2);
                    assertEquals(new AbsolutePosition(7, 1, 8), expression.getAbsolutePosition());
                    return expression;
                });
            }
            List<Future<SyntaxData>> results = pool.invokeAll(tasks);

            SyntaxData expected = root.getChild(2).getChild(0).getChild(2);
            for (Future<SyntaxData> result : results) {
                assertSame(expected, result.get());
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
    }
}
