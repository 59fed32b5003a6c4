package org.cadsync.console.api;

/**
 * Closed set of failure classes a console has to react to differently.
 */
public enum ErrorKind {
    /**
     * The server rejected the operation for the entity's current state. Report, never retry.
     */
    VALIDATION,
    /**
     * No response, a transport failure, or the server could not process the request.
     */
    NETWORK,
    /**
     * Credentials rejected after the single refresh-and-retry.
     */
    AUTH
}
