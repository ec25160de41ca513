package com.luanvv.parker.core;

public class TokenExtractionException extends ParkerException {

    public TokenExtractionException(String page) {
        super("Could not extract CSRF token from " + page + ".");
    }
}
