package com.luanvv.parker.core;

import com.luanvv.parker.model.Credentials;
import java.util.Optional;

public interface CredentialStore {

    Optional<Credentials> get();

    void set(Credentials credentials);

    default Optional<String> email() {
        return get().map(Credentials::email).filter(e -> !e.isBlank());
    }
}
