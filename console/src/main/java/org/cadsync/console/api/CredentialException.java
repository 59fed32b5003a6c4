package org.cadsync.console.api;

import java.io.IOException;

/**
 * The credential provider could not supply a token. The request never left the client, so this says
 * nothing about whether the dispatch service is reachable.
 */
public class CredentialException extends IOException {

    private static final long serialVersionUID = 1L;

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
