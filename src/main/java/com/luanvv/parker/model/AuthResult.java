package com.luanvv.parker.model;

public record AuthResult(boolean ok, String message) {

    public static AuthResult success(String message) {
        return new AuthResult(true, message);
    }

    public static AuthResult failure(String message) {
        return new AuthResult(false, message);
    }
}
