package org.cadsync.console.api;

import okhttp3.Interceptor;
import okhttp3.OkHttpClient;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Builds the OkHttp clients the console shares. All of them reuse one connection pool and dispatcher.
 */
public final class HttpClients {

    private HttpClients() {
    }

    /**
     * Authenticated client without offline queueing. Used for replays, probes and the realtime channel.
     */
    public static OkHttpClient authenticated(CredentialProvider credentials, long connectTimeoutSeconds, long readTimeoutSeconds) {
        Objects.requireNonNull(credentials, "credentials must not be null");
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .addInterceptor(new AuthInterceptor(credentials))
                .authenticator(new CredentialRefreshAuthenticator(credentials))
                .build();
    }

    /**
     * Derive a client whose outermost interceptor is {@code first}, so it sees requests before authentication.
     */
    public static OkHttpClient withOutermost(OkHttpClient base, Interceptor first) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(first, "first must not be null");
        OkHttpClient.Builder builder = base.newBuilder();
        builder.interceptors().add(0, first);
        return builder.build();
    }
}
