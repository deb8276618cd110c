package se.kth.syntax.nodes;

import java.util.ArrayList;
import java.util.List;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.SourcePresence;
import se.kth.syntax.raw.SyntaxKind;
import se.kth.syntax.validation.SyntaxValidator;

/**
 * A mutable sequence of children being assembled for one node. Every value put into it is checked
 * against the slot or element rule of the node's kind; the staged layout as a whole is only
 * validated once it is frozen into a node and viewed.
 */
final class StagedLayout {
    private final SyntaxKind kind;
    private final List<RawSyntax> layout;

    /**
     * @param blank A node whose children seed the layout.
     */
    StagedLayout(RawSyntax blank) {
        this.kind = blank.getKind();
        this.layout = new ArrayList<>(blank.getLayout());
    }

    void use(Enum<?> cursor, RawSyntax value) {
        SyntaxValidator.validateSlot(kind, cursor.ordinal(), value).orThrow();
        layout.set(cursor.ordinal(), value);
    }

    void append(RawSyntax element) {
        SyntaxValidator.validateElement(kind, layout.size(), element).orThrow();
        layout.add(element);
    }

    int size() {
        return layout.size();
    }

    /**
     * @return A present node holding a copy of the staged children. Later changes to the staged
     *     layout do not affect it.
     */
    RawSyntax freeze() {
        return RawSyntax.make(kind, layout, SourcePresence.PRESENT);
    }
}
