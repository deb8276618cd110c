package se.kth.syntax.validation;

import java.util.Objects;
import se.kth.syntax.raw.SyntaxKind;

/**
 * A single way in which a node breaks the layout contract of its kind. The slot is the index of
 * the offending child, or {@link #NODE} when the problem concerns the node as a whole (wrong kind,
 * wrong number of children).
 */
public final class ShapeViolation {
    public static final int NODE = -1;

    private final SyntaxKind kind;
    private final int slot;
    private final String message;

    public ShapeViolation(SyntaxKind kind, int slot, String message) {
        this.kind = kind;
        this.slot = slot;
        this.message = message;
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public int getSlot() {
        return slot;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShapeViolation that = (ShapeViolation) o;
        return slot == that.slot && kind == that.kind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, slot, message);
    }

    @Override
    public String toString() {
        return slot == NODE ? kind + ": " + message : kind + "[" + slot + "]: " + message;
    }
}
