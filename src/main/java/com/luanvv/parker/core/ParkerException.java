package com.luanvv.parker.core;

public class ParkerException extends RuntimeException {

    public ParkerException(String message) {
        super(message);
    }

    public ParkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
