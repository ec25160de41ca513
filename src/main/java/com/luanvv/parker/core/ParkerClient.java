package com.luanvv.parker.core;

import com.luanvv.parker.model.AuthResult;
import com.luanvv.parker.model.CreateResult;
import com.luanvv.parker.model.LookupResult;
import com.luanvv.parker.model.ProfileRef;
import java.time.LocalDate;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ParkerClient implements AutoCloseable {
    @Getter private final SessionAuthenticator authenticator;
    @Getter private final CandidateResolver resolver;
    @Getter private final CandidateCreator creator;
    private final AutoCloseable transport;

    public ParkerClient(Config config, CrmHttpClient http, CredentialStore credentials) {
        FormTokenExtractor tokens = new FormTokenExtractor();
        PageDataExtractor pages = new PageDataExtractor();
        this.authenticator = new SessionAuthenticator(config, http, credentials, tokens);
        this.resolver = new CandidateResolver(http, authenticator, tokens, pages, new SearchResultMatcher());
        this.creator = new CandidateCreator(config, http, authenticator, credentials, tokens, pages);
        this.transport = http instanceof AutoCloseable closeable ? closeable : null;
    }

    /** Opens a Playwright-backed session against {@code config.baseUrl}. */
    public static ParkerClient open(Config config, CredentialStore credentials) {
        CrmSession session = new CrmSession(config);
        session.start();
        return new ParkerClient(config, session, credentials);
    }

    public boolean checkAuthenticated() {
        return authenticator.isActive();
    }

    public AuthResult login(String email, String password) {
        return authenticator.login(email, password);
    }

    /** Signs in with the stored credentials. */
    public AuthResult login() {
        return authenticator.login();
    }

    public LookupResult lookup(String url, String firstNameHint, String lastNameHint) {
        return resolver.lookup(url, firstNameHint, lastNameHint);
    }

    public LookupResult lookup(ProfileRef profile) {
        return resolver.lookup(profile);
    }

    public CreateResult create(String firstName, String lastName, String url, LocalDate sourcedDate) {
        return creator.create(firstName, lastName, url, sourcedDate);
    }

    @Override
    public void close() {
        if (transport == null) return;
        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Failed to close CRM session: {}", e.getMessage());
        }
    }
}
