package com.luanvv.parker.model;

public record Credentials(String email, String password) {

    public boolean isComplete() {
        return email != null && !email.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public String toString() {
        return "Credentials[email=" + email + ", password=****]";
    }
}
