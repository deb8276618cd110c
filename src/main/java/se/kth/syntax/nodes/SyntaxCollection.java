package se.kth.syntax.nodes;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import se.kth.syntax.data.SyntaxData;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.validation.SyntaxValidator;

/**
 * Base class of views over list kinds, whose children are a variable number of elements of a
 * single kind. A missing list behaves as an empty one.
 *
 * @param <E> The view type of the elements.
 * @param <C> The concrete collection type, returned by the {@code with} methods.
 */
public abstract class SyntaxCollection<E extends Syntax, C extends SyntaxCollection<E, C>>
        extends Syntax implements Iterable<E> {

    protected SyntaxCollection(SyntaxData data) {
        super(data);
    }

    /**
     * Wrap the context of an element in its view.
     */
    protected abstract E makeElement(SyntaxData elementData);

    /**
     * Wrap the context of a new version of this list in the concrete collection type.
     */
    protected abstract C makeCollection(SyntaxData collectionData);

    public int size() {
        return data.getNumChildren();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public E get(int index) {
        return makeElement(data.getChild(index));
    }

    /**
     * @return All elements in order.
     */
    public List<E> getElements() {
        List<E> elements = new ArrayList<>(size());
        for (E element : this) {
            elements.add(element);
        }
        return elements;
    }

    /**
     * @return A new list with the element appended.
     */
    public C withAdditionalElement(E element) {
        RawSyntax raw = element.getRaw();
        SyntaxValidator.validateElement(getKind(), size(), raw).orThrow();
        return makeCollection(replaceSelf(getRaw().appendChild(raw)));
    }

    /**
     * @return A new list with the element at the index replaced.
     */
    public C withElement(int index, E element) {
        RawSyntax raw = element.getRaw();
        SyntaxValidator.validateElement(getKind(), index, raw).orThrow();
        return makeCollection(data.replaceChild(index, raw));
    }

    @Override
    public Iterator<E> iterator() {
        return new Iterator<E>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < size();
            }

            @Override
            public E next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(next++);
            }
        };
    }
}
