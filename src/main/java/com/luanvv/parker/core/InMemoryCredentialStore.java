package com.luanvv.parker.core;

import com.luanvv.parker.model.Credentials;
import java.util.Optional;

public class InMemoryCredentialStore implements CredentialStore {
    private volatile Credentials credentials;

    public InMemoryCredentialStore() {
    }

    public InMemoryCredentialStore(Credentials credentials) {
        this.credentials = credentials;
    }

    @Override
    public Optional<Credentials> get() {
        return Optional.ofNullable(credentials);
    }

    @Override
    public void set(Credentials credentials) {
        this.credentials = credentials;
    }
}
