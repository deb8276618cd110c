package se.kth.syntax.raw;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, kind-tagged node of a full-fidelity syntax tree. A raw node knows nothing about
 * its parent or its position in the source; the same instance can therefore be shared by any
 * number of trees, which is how edits avoid copying unchanged subtrees.
 *
 * <p>Construction is shape-agnostic. Whether the children match the layout of the kind is checked
 * by {@link se.kth.syntax.validation.SyntaxValidator} when a typed view is put over the node.
 *
 * <p>Raw nodes use reference identity. Use {@link #isEquivalentTo(RawSyntax)} for a structural
 * comparison.
 */
public class RawSyntax {
    private final SyntaxKind kind;
    private final List<RawSyntax> layout;
    private final SourcePresence presence;

    RawSyntax(SyntaxKind kind, List<RawSyntax> layout, SourcePresence presence) {
        this.kind = Objects.requireNonNull(kind);
        this.layout = layout;
        this.presence = Objects.requireNonNull(presence);
    }

    /**
     * Create a layout node. The children are copied into an unmodifiable list, the nodes
     * themselves are shared.
     *
     * @param kind The kind of the node. Must not be {@link SyntaxKind#TOKEN}.
     * @param layout The children of the node, in source order.
     * @param presence Whether the node is present in the source.
     * @return A new raw node.
     */
    public static RawSyntax make(SyntaxKind kind, List<RawSyntax> layout, SourcePresence presence) {
        if (kind.isToken()) {
            throw new IllegalArgumentException("Token leaves are created with RawTokenSyntax.make");
        }
        List<RawSyntax> copy = new ArrayList<>(layout.size());
        for (RawSyntax child : layout) {
            copy.add(Objects.requireNonNull(child, "null child in layout of " + kind));
        }
        return new RawSyntax(kind, Collections.unmodifiableList(copy), presence);
    }

    /**
     * @param kind The kind of the node.
     * @return A missing marker node of the given kind, with no children.
     */
    public static RawSyntax missing(SyntaxKind kind) {
        return make(kind, Collections.emptyList(), SourcePresence.MISSING);
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public SourcePresence getPresence() {
        return presence;
    }

    public boolean isMissing() {
        return presence == SourcePresence.MISSING;
    }

    public boolean isPresent() {
        return presence == SourcePresence.PRESENT;
    }

    public boolean isToken() {
        return kind.isToken();
    }

    public boolean isExpr() {
        return kind.isExpr();
    }

    public boolean isList() {
        return kind.isList();
    }

    /**
     * @return An unmodifiable view of the children of this node.
     */
    public List<RawSyntax> getLayout() {
        return layout;
    }

    public int getNumChildren() {
        return layout.size();
    }

    public RawSyntax getChild(int index) {
        return layout.get(index);
    }

    /**
     * Create a copy of this node with a single child replaced. Every other child is shared with
     * this node.
     *
     * @param index Index of the child to replace.
     * @param newChild The new child.
     * @return A new node of the same kind and presence.
     */
    public RawSyntax replaceChild(int index, RawSyntax newChild) {
        Objects.requireNonNull(newChild);
        Objects.checkIndex(index, layout.size());
        List<RawSyntax> newLayout = new ArrayList<>(layout);
        newLayout.set(index, newChild);
        return new RawSyntax(kind, Collections.unmodifiableList(newLayout), presence);
    }

    /**
     * Create a copy of this node with an additional child at the end of its layout. Only
     * meaningful for list kinds. The result is always present, as a list with an element in it
     * cannot be missing.
     *
     * @param newChild The child to append.
     * @return A new node of the same kind.
     */
    public RawSyntax appendChild(RawSyntax newChild) {
        Objects.requireNonNull(newChild);
        List<RawSyntax> newLayout = new ArrayList<>(layout.size() + 1);
        newLayout.addAll(layout);
        newLayout.add(newChild);
        return new RawSyntax(kind, Collections.unmodifiableList(newLayout), SourcePresence.PRESENT);
    }

    /**
     * Print the source text of this node, trivia included, to the given builder. Missing nodes
     * print nothing.
     */
    public void print(StringBuilder out) {
        if (isMissing()) {
            return;
        }
        for (RawSyntax child : layout) {
            child.print(out);
        }
    }

    /**
     * @return The source text of this node, trivia included.
     */
    public String print() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }

    /**
     * @return The number of UTF-8 bytes this node contributes to the printed text, the same unit
     *     as {@link AbsolutePosition#getOffset()}.
     */
    public int getTextLength() {
        return accumulateAbsolutePosition(AbsolutePosition.start()).getOffset();
    }

    /**
     * @param start The position at which this node starts.
     * @return The position just past the printed text of this node.
     */
    public AbsolutePosition accumulateAbsolutePosition(AbsolutePosition start) {
        if (isMissing()) {
            return start;
        }
        AbsolutePosition pos = start;
        for (RawSyntax child : layout) {
            pos = child.accumulateAbsolutePosition(pos);
        }
        return pos;
    }

    /**
     * Structural comparison: same kind, presence and, recursively, equivalent children.
     */
    public boolean isEquivalentTo(RawSyntax other) {
        if (this == other) return true;
        if (other == null || other.isToken() || kind != other.kind || presence != other.presence) {
            return false;
        }
        if (layout.size() != other.layout.size()) {
            return false;
        }
        for (int i = 0; i < layout.size(); i++) {
            if (!layout.get(i).isEquivalentTo(other.layout.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return An indented S-expression rendering of this subtree, for debugging.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        dump(sb, 0);
        return sb.toString();
    }

    void dump(StringBuilder out, int indent) {
        indent(out, indent);
        out.append('(').append(kind.name().toLowerCase());
        if (isMissing()) {
            out.append(" [missing]");
        }
        for (RawSyntax child : layout) {
            out.append('\n');
            child.dump(out, indent + 1);
        }
        out.append(')');
    }

    static void indent(StringBuilder out, int indent) {
        for (int i = 0; i < indent; i++) {
            out.append("  ");
        }
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + (isMissing() ? "[missing]" : "") + "/" + layout.size();
    }
}
