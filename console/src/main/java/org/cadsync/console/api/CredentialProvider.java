package org.cadsync.console.api;

import java.io.IOException;

/**
 * Source of the bearer credential, owned by the session collaborator.
 */
public interface CredentialProvider {

    /**
     * Current access token, or {@code null} when there is no session.
     */
    String getAccessToken() throws IOException;

    /**
     * Ask the session collaborator for a fresh credential after the server rejected the current one.
     *
     * @return true if a new token is now available from {@link #getAccessToken()}
     */
    boolean refreshCredentials() throws IOException;

    /**
     * Called when a request is still rejected after one refresh, or the refresh itself failed.
     * The collaborator is expected to fall back to its logged-out state.
     */
    void onAuthenticationFailed();
}
