package com.luanvv.parker.core;

public class RecordParseException extends ParkerException {

    public RecordParseException(String message) {
        super(message);
    }
}
