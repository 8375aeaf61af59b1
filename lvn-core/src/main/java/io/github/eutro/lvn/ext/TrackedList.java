package io.github.eutro.lvn.ext;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

/**
 * A list view which is notified whenever an element enters or leaves it.
 * <p>
 * The IR uses this to keep owner exts up to date as blocks and effects
 * are added to their parents.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    protected TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public E set(int index, E element) {
        E old = viewed.set(index, element);
        onRemoved(old);
        onAdded(element);
        return old;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E remove(int index) {
        E old = viewed.remove(index);
        onRemoved(old);
        return old;
    }
}
