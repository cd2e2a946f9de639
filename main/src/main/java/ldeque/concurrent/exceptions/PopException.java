package ldeque.concurrent.exceptions;

import java.io.Serial;

public final class PopException extends Exception {
    @Serial
    private static final long serialVersionUID = 4412853204637145170L;

    public PopException() {
        super("deque: pop from empty queue");
    }
}
