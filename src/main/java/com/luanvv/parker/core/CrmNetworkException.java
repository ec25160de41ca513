package com.luanvv.parker.core;

import lombok.Getter;

@Getter
public class CrmNetworkException extends ParkerException {
    private final int status;

    public CrmNetworkException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public CrmNetworkException(String message, int status) {
        super(message + " (HTTP " + status + ")");
        this.status = status;
    }
}
