package com.luanvv.parker.core;

import com.luanvv.parker.model.Credentials;
import java.util.Optional;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class EnvCredentialStore implements CredentialStore {
    private final Config.Login login;
    private final UnaryOperator<String> env;
    private volatile Credentials override;

    public EnvCredentialStore(Config.Login login) {
        this(login, System::getenv);
    }

    EnvCredentialStore(Config.Login login, UnaryOperator<String> env) {
        this.login = login;
        this.env = env;
    }

    @Override
    public Optional<Credentials> get() {
        if (override != null) {
            return Optional.of(override);
        }
        String email = env.apply(login.getEmailEnv());
        String password = env.apply(login.getPasswordEnv());
        if (email == null || password == null) {
            log.debug("Credentials not set in env vars {} / {}", login.getEmailEnv(), login.getPasswordEnv());
            return Optional.empty();
        }
        return Optional.of(new Credentials(email.trim(), password));
    }

    @Override
    public void set(Credentials credentials) {
        this.override = credentials;
    }
}
