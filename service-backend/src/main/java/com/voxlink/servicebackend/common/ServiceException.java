package com.voxlink.servicebackend.common;

public class ServiceException extends RuntimeException {
    private final ErrorKind kind;

    public ServiceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ServiceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
