package com.luanvv.parker.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.luanvv.parker.model.Credentials;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvCredentialStoreTest {

    @Test
    void readsConfiguredVariables() {
        Map<String, String> env = Map.of("PARKER_EMAIL", " recruiter@example.com ", "PARKER_PASSWORD", "s3cret");
        EnvCredentialStore store = new EnvCredentialStore(new Config.Login(), env::get);

        assertThat(store.get()).contains(new Credentials("recruiter@example.com", "s3cret"));
        assertThat(store.email()).contains("recruiter@example.com");
    }

    @Test
    void emptyWhenAVariableIsMissing() {
        EnvCredentialStore store = new EnvCredentialStore(new Config.Login(), Map.of("PARKER_EMAIL", "a@b.c")::get);

        assertThat(store.get()).isEmpty();
        assertThat(store.email()).isEmpty();
    }

    @Test
    void runtimeValueShadowsEnvironment() {
        EnvCredentialStore store = new EnvCredentialStore(new Config.Login(), Map.<String, String>of()::get);
        store.set(new Credentials("new@example.com", "pw"));

        assertThat(store.get()).contains(new Credentials("new@example.com", "pw"));
    }

    @Test
    void passwordIsMaskedInToString() {
        assertThat(new Credentials("a@b.c", "hunter2").toString()).doesNotContain("hunter2");
    }
}
