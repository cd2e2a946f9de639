package ldeque.concurrent;

import java.util.Iterator;

/**
 * An iterator that may hold a resource (a lock) while it is being consumed.
 * The resource is released once the iterator is exhausted or closed,
 * closing is idempotent.
 */
public interface Traversal<E> extends Iterator<E>, AutoCloseable {

    @Override
    void close();
}
