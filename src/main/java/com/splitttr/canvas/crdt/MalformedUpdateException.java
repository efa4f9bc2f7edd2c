package com.splitttr.canvas.crdt;

public class MalformedUpdateException extends RuntimeException {

    public MalformedUpdateException(String message) {
        super(message);
    }

    public MalformedUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
