// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.auth;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.conduit.core.error.BackendAuthException;
import sh.conduit.core.error.SignatureVerificationException;

/**
 * {@link BackendAuthClient} over HTTP with JSON bodies.
 * <ul>
 *   <li>{@code GET /api/auth/siwe/nonce} returns {@code {"nonce": ...}}</li>
 *   <li>{@code POST /api/auth/verify} takes {@code {message, signature}}</li>
 *   <li>{@code POST /api/auth/login} takes {@code {token, walletAddress}} with the token as bearer</li>
 *   <li>{@code POST /api/auth/logout} with the session token as bearer</li>
 * </ul>
 * Login responses carry the session token in {@code token}.
 */
public final class HttpBackendAuthClient implements BackendAuthClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpBackendAuthClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String NONCE_PATH = "/api/auth/siwe/nonce";
    static final String VERIFY_PATH = "/api/auth/verify";
    static final String LOGIN_PATH = "/api/auth/login";
    static final String LOGOUT_PATH = "/api/auth/logout";

    private final URI baseUri;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    private HttpBackendAuthClient(final URI baseUri, final Duration connectTimeout, final Duration requestTimeout) {
        this.baseUri = baseUri;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
    }

    public static Builder builder(final String baseUrl) {
        return new Builder(baseUrl);
    }

    @Override
    public String fetchNonce() {
        final HttpRequest request = newRequest(NONCE_PATH).GET().build();
        final JsonNode body = readJson(NONCE_PATH, send(NONCE_PATH, request, false));
        return requireText(NONCE_PATH, body, "nonce");
    }

    @Override
    public String login(final LoginRequest login) {
        Objects.requireNonNull(login, "login");
        if (login instanceof LoginRequest.SignedMessage signed) {
            final Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("message", signed.message());
            payload.put("signature", signed.signature().value());
            final HttpRequest request = newRequest(VERIFY_PATH)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(payload)))
                    .build();
            final JsonNode body = readJson(VERIFY_PATH, send(VERIFY_PATH, request, true));
            return requireText(VERIFY_PATH, body, "token");
        }
        final LoginRequest.Token token = (LoginRequest.Token) login;
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("token", token.token());
        payload.put("walletAddress", token.walletAddress().value());
        final HttpRequest request = newRequest(LOGIN_PATH)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + token.token())
                .POST(HttpRequest.BodyPublishers.ofString(toJson(payload)))
                .build();
        final JsonNode body = readJson(LOGIN_PATH, send(LOGIN_PATH, request, false));
        final JsonNode issued = body.get("token");
        return issued != null && issued.isTextual() ? issued.asText() : token.token();
    }

    @Override
    public void logout(final String token) {
        final HttpRequest request = newRequest(LOGOUT_PATH)
                .header("Authorization", "Bearer " + token)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        send(LOGOUT_PATH, request, false);
        LOG.debug("Backend session logged out");
    }

    private HttpRequest.Builder newRequest(final String path) {
        return HttpRequest.newBuilder(baseUri.resolve(path))
                .header("Accept", "application/json")
                .timeout(requestTimeout);
    }

    private String send(final String path, final HttpRequest request, final boolean verifiesSignature) {
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendAuthException("Interrupted calling " + path, e);
        } catch (IOException e) {
            throw new BackendAuthException("Network error calling " + path, e);
        }
        final int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body();
        }
        final String reason = errorMessage(response.body());
        if (verifiesSignature && status == 401) {
            throw new SignatureVerificationException(
                    "Backend rejected the signature" + (reason != null ? ": " + reason : ""));
        }
        throw new BackendAuthException(
                path + " failed with status " + status + (reason != null ? ": " + reason : ""), status);
    }

    private static JsonNode readJson(final String path, final String body) {
        try {
            final JsonNode node = MAPPER.readTree(body == null ? "" : body);
            if (node == null || !node.isObject()) {
                throw new BackendAuthException(path + " returned a non-object body", 200);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new BackendAuthException("Unable to parse response from " + path, e);
        }
    }

    private static String requireText(final String path, final JsonNode body, final String field) {
        final JsonNode value = body.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new BackendAuthException(path + " response is missing '" + field + "'", 200);
        }
        return value.asText();
    }

    private static @Nullable String errorMessage(final String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            final JsonNode error = MAPPER.readTree(body).get("error");
            return error != null && error.isTextual() ? error.asText() : null;
        } catch (JsonProcessingException e) {
            LOG.debug("Error body is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private static String toJson(final Map<String, Object> payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BackendAuthException("Unable to serialize auth request", e);
        }
    }

    public static final class Builder {
        private final String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        private Builder(final String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder requestTimeout(final Duration requestTimeout) {
            if (requestTimeout != null) {
                this.requestTimeout = requestTimeout;
            }
            return this;
        }

        public HttpBackendAuthClient build() {
            return new HttpBackendAuthClient(URI.create(baseUrl), connectTimeout, requestTimeout);
        }
    }
}
