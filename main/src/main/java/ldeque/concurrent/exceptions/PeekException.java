package ldeque.concurrent.exceptions;

import java.io.Serial;

public final class PeekException extends Exception {
    @Serial
    private static final long serialVersionUID = -2281063979851727398L;

    private final int index;

    public PeekException(final int index) {
        super(String.format("deque: index %d out of bounds", index));
        this.index = index;
    }

    public int index() {
        return this.index;
    }
}
