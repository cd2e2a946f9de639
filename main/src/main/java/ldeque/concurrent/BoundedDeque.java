package ldeque.concurrent;

import ldeque.concurrent.exceptions.PeekException;
import ldeque.concurrent.exceptions.PopException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A double-ended queue with an optional capacity bound.
 * <p>
 * A bounded deque never holds more than {@link #capacity()} elements:
 * inserting into a full deque evicts one element from the opposite end.
 * Implementations are expected to be safe for use by multiple threads.
 *
 * @param <E> the type of elements held in this deque
 */
public interface BoundedDeque<E> {

    /**
     * Capacity value of a deque that grows without limit.
     */
    int UNLIMITED = -1;

    int size();

    /**
     * @return the configured bound, or {@link #UNLIMITED}
     */
    int capacity();

    default boolean isUnlimited() {
        return capacity() == UNLIMITED;
    }

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @return {@code true} iff the deque is bounded and holds
     * {@link #capacity()} elements, an unlimited deque is never full
     */
    default boolean isFull() {
        return !isUnlimited() && size() >= capacity();
    }

    /**
     * Inserts the element at the right end, evicting the leftmost
     * element if the capacity is exceeded.
     */
    void append(E element);

    /**
     * Inserts the element at the left end, evicting the rightmost
     * element if the capacity is exceeded.
     */
    void appendLeft(E element);

    /**
     * Removes and returns the rightmost element.
     *
     * @throws PopException if the deque is empty
     */
    E tryPop() throws PopException;

    /**
     * Removes and returns the leftmost element.
     *
     * @throws PopException if the deque is empty
     */
    E tryPopLeft() throws PopException;

    void clear();

    /**
     * @return the number of elements equal to {@code element},
     * compared by {@link Objects#equals(Object, Object)}
     */
    int count(E element);

    /**
     * Returns the element at the zero-based position counted from the left end.
     *
     * @throws PeekException if {@code index < 0 || index >= size()}
     */
    E tryPeek(int index) throws PeekException;

    /**
     * Same as {@link #tryPeek(int)}, but treats a bad index as a programming
     * error. Use it only where the index is already known to be in range.
     *
     * @throws IllegalStateException with the {@link PeekException} as its
     * cause if the index is out of bounds
     */
    default E peek(final int index) {
        try {
            return tryPeek(index);
        } catch (final PeekException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * Rotates the deque {@code steps} times to the right. A single step
     * to the right moves the rightmost element to the left end, negative
     * values rotate to the left.
     */
    void rotate(int steps);

    /**
     * @return an independent deque with the same capacity and elements
     */
    BoundedDeque<E> copy();

    /**
     * Returns a fresh traversal from the left end to the right end.
     * The traversal holds the deque's lock from its first step until it is
     * exhausted or closed, writers block in the meantime. Modifying the deque
     * from the traversing thread throws
     * {@link java.util.ConcurrentModificationException}.
     */
    Traversal<E> values();

    /**
     * Same as {@link #values()}, but every element is paired with its position.
     */
    default Traversal<Indexed<E>> all() {
        final Traversal<E> values = values();
        return new Traversal<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return values.hasNext();
            }

            @Override
            public Indexed<E> next() {
                final E value = values.next();
                return new Indexed<>(this.index++, value);
            }

            @Override
            public void close() {
                values.close();
            }
        };
    }

    default void forEach(final Consumer<? super E> action) {
        Objects.requireNonNull(action);
        try (final Traversal<E> traversal = values()) {
            traversal.forEachRemaining(action);
        }
    }

    /**
     * The returned stream must be closed if it is not fully consumed,
     * otherwise the lock stays held by the calling thread.
     */
    default Stream<E> stream() {
        final Traversal<E> traversal = values();
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(traversal, Spliterator.ORDERED),
                false
        ).onClose(traversal::close);
    }

    default List<E> toList() {
        final List<E> list = new ArrayList<>();
        forEach(list::add);
        return list;
    }
}
