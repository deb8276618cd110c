package se.kth.syntax.data;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReferenceArray;
import se.kth.syntax.raw.AbsolutePosition;
import se.kth.syntax.raw.RawSyntax;

/**
 * Places a {@link RawSyntax} inside a concrete tree: it knows its parent, its index among the
 * parent's children and the root of the tree. Child contexts are created lazily and cached, so
 * asking for the same child twice yields the same instance.
 *
 * <p>A context never changes the raw node it wraps. Edits go through
 * {@link #replaceChild(int, RawSyntax)}, which rebuilds the ancestors of the edited node (one new
 * raw node per level) and returns a context at the same place in the new tree. Sibling subtrees
 * are shared between the old and new tree.
 *
 * <p>Contexts are safe to share between threads. The child cache and the position cache are only
 * ever filled with values that are fully determined by the immutable tree, so racing
 * initializations at worst compute the same value twice, and the child cache publishes a single
 * winner.
 */
public final class SyntaxData {
    private final RawSyntax raw;
    private final SyntaxData parent;
    private final SyntaxData root;
    private final int indexInParent;
    private final AtomicReferenceArray<SyntaxData> children;
    private volatile AbsolutePosition position;

    private SyntaxData(RawSyntax raw, SyntaxData parent, int indexInParent) {
        this.raw = Objects.requireNonNull(raw);
        this.parent = parent;
        this.root = parent == null ? this : parent.root;
        this.indexInParent = indexInParent;
        this.children = new AtomicReferenceArray<>(raw.getNumChildren());
    }

    /**
     * @param raw The root of a tree.
     * @return A context for the root of a new tree.
     */
    public static SyntaxData make(RawSyntax raw) {
        return new SyntaxData(raw, null, 0);
    }

    public RawSyntax getRaw() {
        return raw;
    }

    public Optional<SyntaxData> getParent() {
        return Optional.ofNullable(parent);
    }

    public SyntaxData getRoot() {
        return root;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * @return The index of this node among its parent's children, 0 for a root.
     */
    public int getIndexInParent() {
        return indexInParent;
    }

    public int getNumChildren() {
        return children.length();
    }

    /**
     * @param index Index of a child of the wrapped raw node.
     * @return The context of that child in this tree.
     * @throws IndexOutOfBoundsException If there is no such child.
     */
    public SyntaxData getChild(int index) {
        Objects.checkIndex(index, children.length());
        SyntaxData child = children.get(index);
        if (child == null) {
            SyntaxData fresh = new SyntaxData(raw.getChild(index), this, index);
            if (children.compareAndSet(index, null, fresh)) {
                return fresh;
            }
            child = children.get(index);
        }
        return child;
    }

    public Optional<SyntaxData> getPreviousSibling() {
        if (parent == null || indexInParent == 0) {
            return Optional.empty();
        }
        return Optional.of(parent.getChild(indexInParent - 1));
    }

    public Optional<SyntaxData> getNextSibling() {
        if (parent == null || indexInParent + 1 >= parent.getNumChildren()) {
            return Optional.empty();
        }
        return Optional.of(parent.getChild(indexInParent + 1));
    }

    /**
     * Compute where this node starts in the printed text of the whole tree, leading trivia
     * included. The value is derived from the text of everything printed before this node and
     * cached in this context.
     */
    public AbsolutePosition getAbsolutePosition() {
        AbsolutePosition pos = position;
        if (pos == null) {
            pos = computeAbsolutePosition();
            position = pos;
        }
        return pos;
    }

    private AbsolutePosition computeAbsolutePosition() {
        if (parent == null) {
            return AbsolutePosition.start();
        }
        AbsolutePosition pos = parent.getAbsolutePosition();
        RawSyntax parentRaw = parent.raw;
        for (int i = 0; i < indexInParent; i++) {
            pos = parentRaw.getChild(i).accumulateAbsolutePosition(pos);
        }
        return pos;
    }

    /**
     * @return The position just past the printed text of this node.
     */
    public AbsolutePosition getEndPosition() {
        return raw.accumulateAbsolutePosition(getAbsolutePosition());
    }

    /**
     * Replace a child of this node.
     *
     * @param index Index of the child to replace.
     * @param newChild The new raw child.
     * @return The context of the edited node in the new tree.
     */
    public SyntaxData replaceChild(int index, RawSyntax newChild) {
        return replaceSelf(raw.replaceChild(index, newChild));
    }

    /**
     * Replace the raw node of this context, rebuilding every ancestor up to a new root.
     *
     * @param newRaw The node to put in place of this one.
     * @return The context of the new node in the new tree.
     */
    public SyntaxData replaceSelf(RawSyntax newRaw) {
        if (parent == null) {
            return make(newRaw);
        }
        SyntaxData newParent = parent.replaceChild(indexInParent, newRaw);
        return newParent.getChild(indexInParent);
    }

    /**
     * Wrap a different raw node at the place of this one without editing the tree. Used to read
     * a missing marker as if it had the children of its layout.
     *
     * @param substitute The node to read in place of this one.
     * @return A context with the same parent and index as this one.
     */
    public SyntaxData substitute(RawSyntax substitute) {
        return new SyntaxData(substitute, parent, indexInParent);
    }

    @Override
    public String toString() {
        return "SyntaxData{" + raw + " at " + getAbsolutePosition() + "}";
    }
}
