package org.cadsync.console;

import org.cadsync.console.api.CredentialProvider;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Credential provider with a fixed token sequence: each refresh moves to the next token.
 */
public final class TestCredentials implements CredentialProvider {

    private final String[] tokens;
    private final boolean refreshSucceeds;
    private final AtomicInteger index = new AtomicInteger();
    private final AtomicInteger refreshes = new AtomicInteger();
    private final AtomicInteger authFailures = new AtomicInteger();

    public TestCredentials(boolean refreshSucceeds, String... tokens) {
        this.refreshSucceeds = refreshSucceeds;
        this.tokens = tokens;
    }

    public static TestCredentials fixed(String token) {
        return new TestCredentials(true, token);
    }

    @Override
    public String getAccessToken() {
        return tokens[Math.min(index.get(), tokens.length - 1)];
    }

    @Override
    public boolean refreshCredentials() {
        refreshes.incrementAndGet();
        if (!refreshSucceeds) {
            return false;
        }
        index.incrementAndGet();
        return true;
    }

    @Override
    public void onAuthenticationFailed() {
        authFailures.incrementAndGet();
    }

    public int getRefreshes() {
        return refreshes.get();
    }

    public int getAuthFailures() {
        return authFailures.get();
    }
}
