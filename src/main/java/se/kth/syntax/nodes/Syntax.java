package se.kth.syntax.nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.AbsolutePosition;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.validation.SyntaxLayout;
import se.kth.syntax.validation.SyntaxValidator;
import se.kth.syntax.validation.ValidationResult;

/**
 * Base class of all typed views. A typed view is a thin, validated lens over a {@link SyntaxData}:
 * it names the children of its kind and offers {@code withX} methods that produce new trees.
 *
 * <p>The wrapped node is validated against the layout of the view's kind when the view is
 * created; a mismatch raises a {@link se.kth.syntax.exception.ShapeViolationException}.
 */
public abstract class Syntax {
    protected final SyntaxData data;
    private final SyntaxData slotData;

    protected Syntax(SyntaxData data) {
        this.data = data;
        validate().orThrow();
        this.slotData = slotsOf(data);
    }

    /**
     * A missing marker of a fixed kind has no children of its own; its slots read as those of the
     * blank node of the kind, and filling one of them makes the node present.
     */
    private static SyntaxData slotsOf(SyntaxData data) {
        RawSyntax raw = data.getRaw();
        SyntaxLayout layout = SyntaxLayout.of(raw.getKind());
        if (raw.isMissing() && raw.getNumChildren() == 0 && layout.isFixed() && layout.getNumSlots() > 0) {
            return data.substitute(SyntaxFactory.makeBlank(raw.getKind()).getRaw());
        }
        return data;
    }

    /**
     * Check the wrapped node against the layout of this view. Subclasses have no state of their
     * own, so this runs safely from the constructor.
     */
    protected abstract ValidationResult validate();

    /**
     * @return The context of the child in the slot named by the cursor.
     */
    protected SyntaxData getChild(Enum<?> cursor) {
        return slotData.getChild(cursor.ordinal());
    }

    /**
     * Check a new child against the slot named by the cursor and put it there.
     *
     * @return The context of this node in the new tree.
     */
    protected SyntaxData replaceChild(Enum<?> cursor, RawSyntax newChild) {
        SyntaxValidator.validateSlot(getKind(), cursor.ordinal(), newChild).orThrow();
        return slotData.replaceChild(cursor.ordinal(), newChild);
    }

    /**
     * Check a new version of this node against the slot it occupies in its parent and put it
     * there.
     *
     * @return The context of the new node in the new tree.
     */
    protected SyntaxData replaceSelf(RawSyntax newRaw) {
        Optional<SyntaxData> parent = data.getParent();
        if (parent.isPresent()) {
            SyntaxValidator.validateChild(
                    parent.get().getRaw().getKind(), data.getIndexInParent(), newRaw).orThrow();
        }
        return data.replaceSelf(newRaw);
    }

    public SyntaxData getData() {
        return data;
    }

    public RawSyntax getRaw() {
        return data.getRaw();
    }

    public SyntaxKind getKind() {
        return data.getRaw().getKind();
    }

    public boolean isMissing() {
        return data.getRaw().isMissing();
    }

    public boolean isPresent() {
        return data.getRaw().isPresent();
    }

    /**
     * @return A typed view of the root of the tree this view belongs to.
     */
    public Syntax getRoot() {
        return SyntaxFactory.makeTyped(data.getRoot());
    }

    public Optional<Syntax> getParent() {
        return data.getParent().map(SyntaxFactory::makeTyped);
    }

    /**
     * @return Where this node starts in the printed text of the whole tree, leading trivia
     *     included.
     */
    public AbsolutePosition getAbsolutePosition() {
        return data.getAbsolutePosition();
    }

    /**
     * @return Every present token of this subtree, in source order.
     */
    public List<TokenSyntax> getTokens() {
        List<TokenSyntax> tokens = new ArrayList<>();
        collectTokens(data, tokens);
        return tokens;
    }

    private static void collectTokens(SyntaxData current, List<TokenSyntax> tokens) {
        RawSyntax raw = current.getRaw();
        if (raw.isMissing()) {
            return;
        }
        if (raw.isToken()) {
            tokens.add(new TokenSyntax(current));
            return;
        }
        for (int i = 0; i < current.getNumChildren(); i++) {
            collectTokens(current.getChild(i), tokens);
        }
    }

    /**
     * @return The source text of this node, trivia included.
     */
    public String print() {
        return data.getRaw().print();
    }

    @Override
    public String toString() {
        return print();
    }
}
