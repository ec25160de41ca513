package com.luanvv.parker.core;

public class AuthenticationException extends ParkerException {

    public AuthenticationException(String message) {
        super(message);
    }
}
