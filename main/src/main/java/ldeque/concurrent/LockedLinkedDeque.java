package ldeque.concurrent;

import ldeque.concurrent.exceptions.PeekException;
import ldeque.concurrent.exceptions.PopException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link BoundedDeque} backed by a doubly linked list.
 * <p>
 * All mutable state (both ends and the size) is guarded by a single lock.
 * Insertions into a full deque evict from the opposite end within the
 * same critical section, so a bounded deque is never observed over its capacity.
 * Lookups by index walk from whichever end is closer.
 * <p>
 * The lock is never acquired twice by one operation: the unlocked
 * {@code link*}/{@code unlink*} methods below assume it is already held.
 * <p>
 * A thread that holds an open {@link Traversal} may still read the deque,
 * but any modification from that thread fails with
 * {@link java.util.ConcurrentModificationException} until the traversal
 * is exhausted or closed.
 *
 * @param <E> the type of elements held in this deque
 */
public final class LockedLinkedDeque<E> implements BoundedDeque<E> {
    private static final Logger LOG = LoggerFactory.getLogger(LockedLinkedDeque.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final int capacity;

    private Node<E> head, tail;
    private int size;
    // traversals currently holding the lock, all on the owner thread
    private int traversals;

    public LockedLinkedDeque() {
        this(UNLIMITED);
    }

    /**
     * @param capacity a non-negative bound, or {@link #UNLIMITED}
     * @throws IllegalArgumentException if {@code capacity} is any other negative value
     */
    public LockedLinkedDeque(final int capacity) {
        if (capacity < UNLIMITED) {
            throw new IllegalArgumentException(String.format(
                    "Capacity must be non-negative or %d (unlimited), got %d",
                    UNLIMITED, capacity)
            );
        }
        this.capacity = capacity;
    }

    public static <E> LockedLinkedDeque<E> unlimited() {
        return new LockedLinkedDeque<>(UNLIMITED);
    }

    /**
     * Builds a deque by appending every element of the source in order.
     * If the source is longer than a bounded capacity only its last
     * {@code capacity} elements are kept.
     */
    public static <E> LockedLinkedDeque<E> of(@NotNull final Iterator<? extends E> source,
                                              final int capacity) {
        Objects.requireNonNull(source);
        final LockedLinkedDeque<E> deque = new LockedLinkedDeque<>(capacity);
        deque.lock.lock();
        try {
            while (source.hasNext()) {
                deque.linkLast(source.next());
            }
        } finally {
            deque.lock.unlock();
        }
        return deque;
    }

    public static <E> LockedLinkedDeque<E> of(@NotNull final Iterable<? extends E> source,
                                              final int capacity) {
        return of(source.iterator(), capacity);
    }

    @Override
    public int size() {
        this.lock.lock();
        try {
            return this.size;
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return this.capacity;
    }

    @Override
    public void append(final E element) {
        this.lock.lock();
        try {
            ensureNotTraversing();
            linkLast(element);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public void appendLeft(final E element) {
        this.lock.lock();
        try {
            ensureNotTraversing();
            linkFirst(element);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public E tryPop() throws PopException {
        this.lock.lock();
        try {
            ensureNotTraversing();
            if (this.size == 0) {
                throw new PopException();
            }
            return unlinkLast();
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public E tryPopLeft() throws PopException {
        this.lock.lock();
        try {
            ensureNotTraversing();
            if (this.size == 0) {
                throw new PopException();
            }
            return unlinkFirst();
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public void clear() {
        this.lock.lock();
        try {
            ensureNotTraversing();
            // the whole chain becomes unreachable at once
            this.head = this.tail = null;
            this.size = 0;
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public int count(final E element) {
        this.lock.lock();
        try {
            int n = 0;
            for (Node<E> x = this.head; x != null; x = x.next) {
                if (Objects.equals(element, x.item)) {
                    ++n;
                }
            }
            return n;
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public E tryPeek(final int index) throws PeekException {
        this.lock.lock();
        try {
            if (index < 0 || index >= this.size) {
                throw new PeekException(index);
            }
            return node(index).item;
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public void rotate(final int steps) {
        this.lock.lock();
        try {
            ensureNotTraversing();
            final int n = this.size;
            if (n < 2) {
                return;
            }
            // k steps to the right == n - k steps to the left
            int k = steps % n;
            if (k < 0) {
                k += n;
            }
            if (k == 0) {
                return;
            }
            final Node<E> first = node(n - k), last = first.prev;

            this.tail.next = this.head;
            this.head.prev = this.tail;

            last.next = null;
            first.prev = null;
            this.head = first;
            this.tail = last;

            if (LOG.isTraceEnabled()) {
                LOG.trace("Rotated by {} ({} effective steps to the right)", steps, k);
            }
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public LockedLinkedDeque<E> copy() {
        final LockedLinkedDeque<E> dst = new LockedLinkedDeque<>(this.capacity);
        this.lock.lock();
        try {
            // dst is not published yet, its lock is uncontended
            dst.lock.lock();
            try {
                for (Node<E> x = this.head; x != null; x = x.next) {
                    dst.linkLast(x.item);
                }
            } finally {
                dst.lock.unlock();
            }
        } finally {
            this.lock.unlock();
        }
        return dst;
    }

    @Override
    public Traversal<E> values() {
        return new LockedTraversal();
    }

    @Override
    public String toString() {
        final StringJoiner joiner = new StringJoiner(
                ", ", "[", "]");
        this.lock.lock();
        try {
            for (Node<E> x = this.head; x != null; x = x.next) {
                joiner.add(x.toString());
            }
        } finally {
            this.lock.unlock();
        }
        return String.format("Deque{capacity=%s, values=%s}",
                this.capacity == UNLIMITED ? "unlimited" : this.capacity,
                joiner);
    }

    // lock must be held by the caller for everything below

    private void ensureNotTraversing() {
        if (this.traversals > 0) {
            throw new ConcurrentModificationException(
                    "Deque modified by the thread that is traversing it");
        }
    }

    private void linkLast(final E element) {
        final Node<E> x = new Node<>(element), t = this.tail;
        if (t == null) {
            this.head = x;
        } else {
            x.prev = t;
            t.next = x;
        }
        this.tail = x;
        if (++this.size > this.capacity && this.capacity != UNLIMITED) {
            final E evicted = unlinkFirst();
            if (LOG.isTraceEnabled()) {
                LOG.trace("Capacity {} exceeded, evicted {} from the left end",
                        this.capacity, evicted);
            }
        }
    }

    private void linkFirst(final E element) {
        final Node<E> x = new Node<>(element), h = this.head;
        if (h == null) {
            this.tail = x;
        } else {
            x.next = h;
            h.prev = x;
        }
        this.head = x;
        if (++this.size > this.capacity && this.capacity != UNLIMITED) {
            final E evicted = unlinkLast();
            if (LOG.isTraceEnabled()) {
                LOG.trace("Capacity {} exceeded, evicted {} from the right end",
                        this.capacity, evicted);
            }
        }
    }

    private E unlinkFirst() {
        final Node<E> h = this.head, next = h.next;
        if (next == null) {
            this.tail = null;
        } else {
            next.prev = null;
        }
        this.head = next;
        h.unlink();
        --this.size;
        return h.item;
    }

    private E unlinkLast() {
        final Node<E> t = this.tail, prev = t.prev;
        if (prev == null) {
            this.head = null;
        } else {
            prev.next = null;
        }
        this.tail = prev;
        t.unlink();
        --this.size;
        return t.item;
    }

    private Node<E> node(final int index) {
        final int n = this.size;
        if (index < (n >> 1)) {
            Node<E> x = this.head;
            for (int i = 0; i < index; ++i) {
                x = x.next;
            }
            return x;
        } else {
            Node<E> x = this.tail;
            for (int i = n - 1; i > index; --i) {
                x = x.prev;
            }
            return x;
        }
    }

    private final class LockedTraversal implements Traversal<E> {
        private static final int FRESH = 0, HOLDING = 1, RELEASED = 2;

        private int state = FRESH;
        private Node<E> cursor;

        @Override
        public boolean hasNext() {
            if (this.state == FRESH) {
                LockedLinkedDeque.this.lock.lock();
                LockedLinkedDeque.this.traversals++;
                this.state = HOLDING;
                this.cursor = LockedLinkedDeque.this.head;
            }
            if (this.state == RELEASED) {
                return false;
            } else if (this.cursor == null) {
                close();
                return false;
            }
            return true;
        }

        @Override
        public E next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final Node<E> x = this.cursor;
            this.cursor = x.next;
            return x.item;
        }

        @Override
        public void close() {
            if (this.state == HOLDING) {
                this.cursor = null;
                LockedLinkedDeque.this.traversals--;
                LockedLinkedDeque.this.lock.unlock();
            }
            this.state = RELEASED;
        }
    }
}
