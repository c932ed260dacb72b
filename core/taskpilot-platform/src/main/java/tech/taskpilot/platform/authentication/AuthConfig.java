package tech.taskpilot.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for authentication: the upstream Google client, CSRF state
 * retention and dynamic client registration.
 *
 * Example configuration:
 * <pre>
 * taskpilot.auth.google.client-id=1234.apps.googleusercontent.com
 * taskpilot.auth.google.client-secret=${GOOGLE_CLIENT_SECRET}
 * taskpilot.auth.google.redirect-uri=https://tasks.example.com/oauth/callback
 * taskpilot.auth.state.ttl=PT10M
 * taskpilot.auth.clients.expiry=P365D
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "taskpilot.auth")
public interface AuthConfig {

    GoogleConfig google();

    StateConfig state();

    ClientsConfig clients();

    /**
     * Upstream identity provider (first-party client registration with Google).
     */
    interface GoogleConfig {

        @WithName("client-id")
        String clientId();

        @WithName("client-secret")
        String clientSecret();

        /**
         * Default callback URI, used when the flow was not started by a dynamic client.
         */
        @WithName("redirect-uri")
        String redirectUri();

        @WithName("authorization-endpoint")
        @WithDefault("https://accounts.google.com/o/oauth2/v2/auth")
        String authorizationEndpoint();

        @WithName("token-endpoint")
        @WithDefault("https://oauth2.googleapis.com/token")
        String tokenEndpoint();

        @WithName("jwks-uri")
        @WithDefault("https://www.googleapis.com/oauth2/v3/certs")
        String jwksUri();

        /**
         * Accepted {@code iss} values for identity tokens.
         */
        @WithDefault("https://accounts.google.com,accounts.google.com")
        List<String> issuers();

        @WithDefault("openid,https://www.googleapis.com/auth/userinfo.email,https://www.googleapis.com/auth/userinfo.profile,https://www.googleapis.com/auth/calendar.events")
        List<String> scopes();

        @WithName("http-timeout")
        @WithDefault("PT30S")
        Duration httpTimeout();
    }

    /**
     * Pending CSRF state retention. Abandoned flows are evicted after the TTL.
     */
    interface StateConfig {

        @WithDefault("PT10M")
        Duration ttl();

        @WithName("max-entries")
        @WithDefault("10000")
        long maxEntries();
    }

    /**
     * Dynamic client registration limits.
     */
    interface ClientsConfig {

        @WithDefault("P365D")
        Duration expiry();

        @WithName("max-redirect-uris")
        @WithDefault("5")
        int maxRedirectUris();
    }
}
