package se.kth.syntax.raw;

import java.util.Objects;

/**
 * A location in the source text: a UTF-8 byte offset from the start of the text plus a 1-based
 * line and 1-based column. Columns are counted in bytes, so a multi-byte character advances the
 * column by its encoded width.
 *
 * <p>Instances are immutable; {@link #advancedBy(String)} returns the position reached after
 * reading a piece of text.
 */
public final class AbsolutePosition {
    private static final AbsolutePosition START = new AbsolutePosition(0, 1, 1);

    private final int offset;
    private final int line;
    private final int column;
    private final boolean afterCarriageReturn;

    public AbsolutePosition(int offset, int line, int column) {
        this(offset, line, column, false);
    }

    private AbsolutePosition(int offset, int line, int column, boolean afterCarriageReturn) {
        if (offset < 0 || line < 1 || column < 1) {
            throw new IllegalArgumentException(
                    "Invalid position: offset=" + offset + ", line=" + line + ", column=" + column);
        }
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.afterCarriageReturn = afterCarriageReturn;
    }

    /**
     * @return The position of the first byte of a text.
     */
    public static AbsolutePosition start() {
        return START;
    }

    /**
     * Compute the position reached after reading the given text starting from this position. Both
     * {@code \n} and a lone {@code \r} end a line; {@code \r\n} counts as a single line break,
     * also when the {@code \r} was the last character of the text this position was reached by.
     * Advancing chunk by chunk therefore gives the same result as advancing over the whole text.
     *
     * @param text Text read from this position.
     * @return The position just past the text.
     */
    public AbsolutePosition advancedBy(String text) {
        if (text.isEmpty()) {
            return this;
        }

        int newOffset = offset;
        int newLine = line;
        int newColumn = column;
        boolean pendingCarriageReturn = afterCarriageReturn;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int width = utf8Width(codePoint);
            newOffset += width;

            if (codePoint == '\r') {
                newLine++;
                newColumn = 1;
                pendingCarriageReturn = true;
            } else if (codePoint == '\n') {
                // the second half of \r\n was already counted
                if (!pendingCarriageReturn) {
                    newLine++;
                }
                newColumn = 1;
                pendingCarriageReturn = false;
            } else {
                newColumn += width;
                pendingCarriageReturn = false;
            }
            i += Character.charCount(codePoint);
        }
        return new AbsolutePosition(newOffset, newLine, newColumn, pendingCarriageReturn);
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) {
            // an unpaired surrogate is encoded as a single '?'
            return Character.isSurrogate((char) codePoint) ? 1 : 3;
        }
        return 4;
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Positions are equal when they point at the same place, regardless of the line break that
     * led there.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AbsolutePosition that = (AbsolutePosition) o;
        return offset == that.offset && line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
