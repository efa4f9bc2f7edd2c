package com.splitttr.canvas.session;

public class CapacityExceededException extends RuntimeException {

    private final int limit;

    public CapacityExceededException(int limit) {
        super("Room is full, limit is " + limit + " sessions");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
