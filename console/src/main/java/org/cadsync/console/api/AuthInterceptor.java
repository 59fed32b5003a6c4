package org.cadsync.console.api;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Interceptor that adds the Authorization header with a Bearer token.
 * A provider failure surfaces as {@link CredentialException}.
 */
public class AuthInterceptor implements Interceptor {
    private static final Logger LOG = Logger.getLogger(AuthInterceptor.class.getName());
    private final CredentialProvider credentials;

    public AuthInterceptor(CredentialProvider credentials) {
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        String token;
        try {
            token = credentials.getAccessToken();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[AuthInterceptor] Failed to get access token", e);
            throw new CredentialException("No access token: " + e.getMessage(), e);
        }

        Request original = chain.request();
        if (token == null || token.isEmpty()) {
            return chain.proceed(original);
        }
        Request.Builder builder = original.newBuilder()
                .header("Authorization", "Bearer " + token);

        return chain.proceed(builder.build());
    }
}
