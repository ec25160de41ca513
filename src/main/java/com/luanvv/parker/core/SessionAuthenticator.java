package com.luanvv.parker.core;

import com.luanvv.parker.model.AuthResult;
import com.luanvv.parker.model.Credentials;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;

@Slf4j
@RequiredArgsConstructor
public class SessionAuthenticator {
    private final Config config;
    private final CrmHttpClient http;
    private final CredentialStore credentials;
    private final FormTokenExtractor tokens;

    public boolean ensureSession() {
        try {
            if (isActive()) return true;
            Optional<Credentials> stored = credentials.get().filter(Credentials::isComplete);
            if (stored.isEmpty()) {
                log.warn("No active CRM session and no stored credentials");
                return false;
            }
            return login(stored.get().email(), stored.get().password()).ok();
        } catch (Exception e) {
            log.error("Could not establish CRM session", e);
            return false;
        }
    }

    /** True when the root page renders for a signed-in user. Never throws. */
    public boolean isActive() {
        try {
            CrmResponse root = http.get(CrmPaths.ROOT);
            if (!root.ok() || onLoginPage(root)) {
                return false;
            }
            String selector = config.getLogin().getLoggedInCheckSelector();
            if (selector == null || selector.isBlank()) return false;
            return Jsoup.parse(root.body()).selectFirst(selector) != null;
        } catch (Exception e) {
            log.debug("Session check failed: {}", e.getMessage());
            return false;
        }
    }

    /** Signs in with the stored credentials. */
    public AuthResult login() {
        Optional<Credentials> stored = credentials.get().filter(Credentials::isComplete);
        if (stored.isEmpty()) {
            return AuthResult.failure("Configure CRM credentials before signing in.");
        }
        return login(stored.get().email(), stored.get().password());
    }

    public AuthResult login(String email, String password) {
        try {
            return doLogin(email, password);
        } catch (AuthenticationException | TokenExtractionException e) {
            log.warn("Login rejected: {}", e.getMessage());
            return AuthResult.failure(e.getMessage());
        } catch (Exception e) {
            log.error("Login failed", e);
            return AuthResult.failure(e.getMessage() != null ? e.getMessage() : "Could not connect to the CRM.");
        }
    }

    private AuthResult doLogin(String email, String password) {
        if (email == null || email.isBlank() || password == null || password.isEmpty()) {
            throw new AuthenticationException("Email and password are required.");
        }
        String loginPath = config.getLogin().getPath();
        log.info("Signing in to {} as {}", config.getBaseUrl(), email);
        CrmResponse page = http.get(loginPath);
        String token = tokens.requireToken(page.body(), "login page");

        Map<String, String> form = new LinkedHashMap<>();
        form.put(CrmPaths.TOKEN_FIELD, token);
        form.put("user[email]", email);
        form.put("user[password]", password);
        form.put("commit", "Sign in");
        CrmResponse result = http.postForm(loginPath, form);

        if (result.ok() && !onLoginPage(result)) {
            log.info("Logged in successfully");
            return AuthResult.success("Logged in to the CRM.");
        }
        throw new AuthenticationException("Login failed. Check email/password.");
    }

    private boolean onLoginPage(CrmResponse response) {
        return response.landedOn(config.getLogin().getPath());
    }
}
