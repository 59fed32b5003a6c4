package org.cadsync.console.api;

import okhttp3.Authenticator;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Answers a 401 by refreshing the credential once and replaying the original request once.
 */
public final class CredentialRefreshAuthenticator implements Authenticator {

    private static final Logger LOG = Logger.getLogger(CredentialRefreshAuthenticator.class.getName());

    private final CredentialProvider credentials;

    public CredentialRefreshAuthenticator(CredentialProvider credentials) {
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
    }

    @Override
    public Request authenticate(Route route, Response response) throws IOException {
        String target = response.request().method() + " " + response.request().url().encodedPath();
        if (response.priorResponse() != null) {
            LOG.warning(() -> "[Auth] " + target + " rejected again after refresh");
            credentials.onAuthenticationFailed();
            return null;
        }

        boolean refreshed;
        try {
            refreshed = credentials.refreshCredentials();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[Auth] Credential refresh failed", e);
            refreshed = false;
        }
        if (!refreshed) {
            credentials.onAuthenticationFailed();
            return null;
        }

        String token = credentials.getAccessToken();
        if (token == null || token.isEmpty()) {
            credentials.onAuthenticationFailed();
            return null;
        }
        LOG.info(() -> "[Auth] Credential refreshed, retrying " + target);
        return response.request().newBuilder()
                .header("Authorization", "Bearer " + token)
                .build();
    }
}
