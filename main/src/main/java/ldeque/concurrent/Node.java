package ldeque.concurrent;

/*
 * Nodes are only touched under the owning deque's lock,
 * so plain fields are enough here.
 */
final class Node<E> {
    final E item;

    Node<E> prev, next;

    Node(final E item) {
        this.item = item;
    }

    void unlink() {
        this.prev = null;
        this.next = null;
    }

    @Override
    public String toString() {
        return String.valueOf(this.item);
    }
}
