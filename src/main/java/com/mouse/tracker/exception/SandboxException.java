package com.mouse.tracker.exception;

public class SandboxException extends RuntimeException {
    public SandboxException() {
        super();
    }

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable e) {
        super(message, e);
    }

}
