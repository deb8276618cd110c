package se.kth.syntax.raw;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AbsolutePositionTest {

    @Test
    void start_shouldBeFirstLineFirstColumn() {
        AbsolutePosition start = AbsolutePosition.start();

        assertEquals(0, start.getOffset());
        assertEquals(1, start.getLine());
        assertEquals(1, start.getColumn());
        assertEquals("1:1", start.toString());
    }

    @Test
    void advancedBy_shouldMoveColumn_onSingleLineText() {
        assertEquals(new AbsolutePosition(3, 1, 4), AbsolutePosition.start().advancedBy("foo"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ab\ncd", "ab\rcd", "ab\r\ncd"})
    void advancedBy_shouldCountOneLineBreak_forEachNewlineConvention(String text) {
        AbsolutePosition pos = AbsolutePosition.start().advancedBy(text);

        assertEquals(2, pos.getLine());
        assertEquals(3, pos.getColumn());
        assertEquals(text.length(), pos.getOffset());
    }

    @Test
    void advancedBy_shouldCountUtf8Bytes_forNonAsciiText() {
        // 'é' is 2 bytes, '€' is 3 bytes and the emoji is 4 bytes in UTF-8
        AbsolutePosition pos = AbsolutePosition.start().advancedBy("é€😀");

        assertEquals(9, pos.getOffset());
        assertEquals(10, pos.getColumn());
    }

    @Test
    void advancedBy_shouldReturnSameInstance_onEmptyText() {
        AbsolutePosition pos = new AbsolutePosition(4, 2, 3);

        assertSame(pos, pos.advancedBy(""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a\r\nb", "a\r\rb", "\r\n\r\n", "x\n\ry", "é\r\n€"})
    void advancedBy_shouldAgreeWithWholeTextScan_whenTextIsSplitAtEveryIndex(String text) {
        AbsolutePosition whole = AbsolutePosition.start().advancedBy(text);

        for (int i = 0; i <= text.length(); i++) {
            AbsolutePosition split = AbsolutePosition.start()
                    .advancedBy(text.substring(0, i))
                    .advancedBy(text.substring(i));

            assertEquals(whole, split, "split at index " + i);
            assertEquals(whole.getLine(), split.getLine(), "split at index " + i);
            assertEquals(whole.getColumn(), split.getColumn(), "split at index " + i);
        }
    }

    @Test
    void advancedBy_shouldCountCrLfOnce_whenCrEndsOneChunkAndLfStartsTheNext() {
        AbsolutePosition pos = AbsolutePosition.start().advancedBy("a\r").advancedBy("\nb");

        assertEquals(2, pos.getLine());
        assertEquals(2, pos.getColumn());
        assertEquals(4, pos.getOffset());
    }

    @Test
    void advancedBy_shouldCountSecondLineBreak_whenNonEmptyChunkSeparatesCrAndLf() {
        AbsolutePosition pos = AbsolutePosition.start()
                .advancedBy("a\r")
                .advancedBy("b")
                .advancedBy("\n");

        assertEquals(3, pos.getLine());
        assertEquals(1, pos.getColumn());
    }

    @Test
    void constructor_shouldRejectNonPositiveLine() {
        assertThrows(IllegalArgumentException.class, () -> new AbsolutePosition(0, 0, 1));
    }
}
