package com.mouse.tracker.exception;

public class InvalidScheduleException extends RuntimeException {
    public InvalidScheduleException() {
        super();
    }

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable e) {
        super(message, e);
    }

}
