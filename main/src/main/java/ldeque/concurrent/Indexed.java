package ldeque.concurrent;

/**
 * An element paired with its zero-based position in the deque.
 */
public record Indexed<E>(int index, E value) { }
