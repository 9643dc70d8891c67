package io.github.eutro.sidefx.ext;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * A list of IR nodes that all have the same owner, kept in an {@code OWNING_*} ext of each node.
 * <p>
 * A node can only be in one such list at a time: adding a node that is still owned elsewhere throws.
 *
 * @param <E> The element type.
 * @param <O> The owner type.
 */
public final class TrackedList<E extends ExtContainer, O> extends AbstractList<E> implements RandomAccess {
    private final List<E> elements;
    private final Ext<O> ownerExt;
    private final O owner;

    public TrackedList(Ext<O> ownerExt, O owner, int initialCapacity) {
        this.elements = new ArrayList<>(initialCapacity);
        this.ownerExt = ownerExt;
        this.owner = owner;
    }

    public TrackedList(Ext<O> ownerExt, O owner) {
        this(ownerExt, owner, 10);
    }

    private void adopt(E elt) {
        O current = elt.getNullable(ownerExt);
        if (current != null) {
            throw new IllegalStateException(ownerExt.getName() + " of " + elt + " is already set");
        }
        elt.attachExt(ownerExt, owner);
    }

    private void release(E elt) {
        elt.removeExt(ownerExt);
    }

    @Override
    public E get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public E set(int index, E element) {
        E old = elements.get(index);
        if (old == element) return old;
        adopt(element);
        elements.set(index, element);
        release(old);
        return old;
    }

    @Override
    public void add(int index, E element) {
        if (index < 0 || index > elements.size()) throw new IndexOutOfBoundsException("index: " + index);
        adopt(element);
        elements.add(index, element);
    }

    @Override
    public E remove(int index) {
        E removed = elements.remove(index);
        release(removed);
        return removed;
    }

    @Override
    public void clear() {
        for (E elt : elements) {
            release(elt);
        }
        elements.clear();
    }
}
