package com.luanvv.parker.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.luanvv.parker.model.AuthResult;
import com.luanvv.parker.model.Credentials;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionAuthenticatorTest {
    @Mock
    private CrmHttpClient http;
    @Mock
    private CredentialStore credentials;

    private SessionAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        authenticator = new SessionAuthenticator(new Config(), http, credentials, new FormTokenExtractor());
    }

    @Test
    void activeWhenRootShowsSignOut() {
        when(http.get("/")).thenReturn(FakeCrm.page("/", Pages.DASHBOARD));

        assertThat(authenticator.isActive()).isTrue();
    }

    @Test
    void inactiveWhenRedirectedToSignIn() {
        when(http.get("/")).thenReturn(FakeCrm.page("/users/sign_in", Pages.SIGN_IN));

        assertThat(authenticator.isActive()).isFalse();
    }

    @Test
    void inactiveWhenNoLogoutAffordance() {
        when(http.get("/")).thenReturn(FakeCrm.page("/", "<html><body><h1>Welcome</h1></body></html>"));

        assertThat(authenticator.isActive()).isFalse();
    }

    @Test
    void inactiveWhenTransportFails() {
        when(http.get("/")).thenThrow(new CrmNetworkException("timeout", null));

        assertThat(authenticator.isActive()).isFalse();
    }

    @Test
    void loginPostsCredentialsWithToken() {
        when(http.get("/users/sign_in")).thenReturn(FakeCrm.page("/users/sign_in", Pages.SIGN_IN));
        when(http.postForm(eq("/users/sign_in"), anyMap())).thenReturn(FakeCrm.page("/", Pages.DASHBOARD));

        AuthResult result = authenticator.login("recruiter@example.com", "s3cret");

        assertThat(result.ok()).isTrue();
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> form = ArgumentCaptor.forClass(Map.class);
        verify(http).postForm(eq("/users/sign_in"), form.capture());
        assertThat(form.getValue())
            .containsEntry("authenticity_token", "login+token==")
            .containsEntry("user[email]", "recruiter@example.com")
            .containsEntry("user[password]", "s3cret")
            .containsEntry("commit", "Sign in");
    }

    @Test
    void loginFailsWhenStillOnSignIn() {
        when(http.get("/users/sign_in")).thenReturn(FakeCrm.page("/users/sign_in", Pages.SIGN_IN));
        when(http.postForm(eq("/users/sign_in"), anyMap())).thenReturn(FakeCrm.page("/users/sign_in", Pages.SIGN_IN));

        AuthResult result = authenticator.login("recruiter@example.com", "wrong");

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).contains("Login failed");
    }

    @Test
    void loginWithoutTokenDoesNotPost() {
        when(http.get("/users/sign_in")).thenReturn(FakeCrm.page("/users/sign_in", "<html>maintenance</html>"));

        AuthResult result = authenticator.login("recruiter@example.com", "s3cret");

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).contains("CSRF token");
        verify(http, never()).postForm(anyString(), anyMap());
    }

    @Test
    void ensureSessionFailsWithoutStoredCredentials() {
        when(http.get("/")).thenReturn(FakeCrm.page("/users/sign_in", Pages.SIGN_IN));
        when(credentials.get()).thenReturn(Optional.empty());

        assertThat(authenticator.ensureSession()).isFalse();
        verify(http, never()).postForm(anyString(), anyMap());
    }

    @Test
    void ensureSessionLogsInWithStoredCredentials() {
        when(http.get("/")).thenReturn(FakeCrm.page("/users/sign_in", Pages.SIGN_IN));
        when(credentials.get()).thenReturn(Optional.of(new Credentials("recruiter@example.com", "s3cret")));
        when(http.get("/users/sign_in")).thenReturn(FakeCrm.page("/users/sign_in", Pages.SIGN_IN));
        when(http.postForm(eq("/users/sign_in"), anyMap())).thenReturn(FakeCrm.page("/", Pages.DASHBOARD));

        assertThat(authenticator.ensureSession()).isTrue();
    }

    @Test
    void ensureSessionSkipsLoginWhenActive() {
        when(http.get("/")).thenReturn(FakeCrm.page("/", Pages.DASHBOARD));

        assertThat(authenticator.ensureSession()).isTrue();
        verify(http, never()).postForm(anyString(), anyMap());
    }

    @Test
    void ensureSessionNeverThrows() {
        when(http.get("/")).thenReturn(FakeCrm.page("/users/sign_in", Pages.SIGN_IN));
        when(credentials.get()).thenReturn(Optional.of(new Credentials("recruiter@example.com", "s3cret")));
        when(http.get("/users/sign_in")).thenThrow(new CrmNetworkException("connection refused", null));

        assertThat(authenticator.ensureSession()).isFalse();
    }
}
