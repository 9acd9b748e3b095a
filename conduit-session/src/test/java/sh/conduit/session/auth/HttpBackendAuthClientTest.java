// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session.auth;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import sh.conduit.core.error.BackendAuthException;
import sh.conduit.core.error.SignatureVerificationException;
import sh.conduit.core.types.Address;
import sh.conduit.core.types.HexData;

class HttpBackendAuthClientTest {

    private static final Address WALLET = new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");

    private HttpServer server;
    private BackendAuthClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        client = HttpBackendAuthClient.builder("http://127.0.0.1:" + server.getAddress().getPort())
                .requestTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void fetchesNonce() {
        AtomicReference<String> method = new AtomicReference<>();
        server.createContext(HttpBackendAuthClient.NONCE_PATH, exchange -> {
            method.set(exchange.getRequestMethod());
            respond(exchange, 200, "{\"nonce\":\"k3Jd9sPq2LmN\"}");
        });

        assertEquals("k3Jd9sPq2LmN", client.fetchNonce());
        assertEquals("GET", method.get());
    }

    @Test
    void lazyAuthSentinelIsPassedThrough() {
        server.createContext(HttpBackendAuthClient.NONCE_PATH,
                exchange -> respond(exchange, 200, "{\"nonce\":\"" + BackendAuthClient.LAZY_AUTH_NONCE + "\"}"));

        assertEquals(BackendAuthClient.LAZY_AUTH_NONCE, client.fetchNonce());
    }

    @Test
    void missingNonceFails() {
        server.createContext(HttpBackendAuthClient.NONCE_PATH, exchange -> respond(exchange, 200, "{\"ok\":true}"));

        BackendAuthException ex = assertThrows(BackendAuthException.class, client::fetchNonce);
        assertTrue(ex.getMessage().contains("'nonce'"));
    }

    @Test
    void nonObjectBodyFails() {
        server.createContext(HttpBackendAuthClient.NONCE_PATH, exchange -> respond(exchange, 200, "[]"));

        assertThrows(BackendAuthException.class, client::fetchNonce);
    }

    @Test
    void signedMessageIsVerified() {
        // Given
        AtomicReference<String> body = new AtomicReference<>();
        AtomicReference<String> contentType = new AtomicReference<>();
        server.createContext(HttpBackendAuthClient.VERIFY_PATH, exchange -> {
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            respond(exchange, 200, "{\"token\":\"eyJhbGciOiJIUzI1NiJ9.e30.c2ln\"}");
        });

        // When
        String token = client.login(new LoginRequest.SignedMessage("line one\nline two", new HexData("0xabcd")));

        // Then
        assertEquals("eyJhbGciOiJIUzI1NiJ9.e30.c2ln", token);
        assertEquals("{\"message\":\"line one\\nline two\",\"signature\":\"0xabcd\"}", body.get());
        assertEquals("application/json", contentType.get());
    }

    @Test
    void rejectedSignatureIsReported() {
        server.createContext(HttpBackendAuthClient.VERIFY_PATH,
                exchange -> respond(exchange, 401, "{\"error\":\"invalid signature\"}"));

        SignatureVerificationException ex = assertThrows(SignatureVerificationException.class,
                () -> client.login(new LoginRequest.SignedMessage("msg", new HexData("0xabcd"))));

        assertTrue(ex.getMessage().contains("invalid signature"));
    }

    @Test
    void serverErrorCarriesStatus() {
        server.createContext(HttpBackendAuthClient.VERIFY_PATH, exchange -> respond(exchange, 500, "oops"));

        BackendAuthException ex = assertThrows(BackendAuthException.class,
                () -> client.login(new LoginRequest.SignedMessage("msg", new HexData("0xabcd"))));

        assertEquals(500, ex.status());
        assertTrue(ex.getMessage().contains(HttpBackendAuthClient.VERIFY_PATH));
    }

    @Test
    void providerTokenLoginUsesBearer() {
        // Given
        AtomicReference<String> authorization = new AtomicReference<>();
        AtomicReference<String> body = new AtomicReference<>();
        server.createContext(HttpBackendAuthClient.LOGIN_PATH, exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"token\":\"social:session-77\"}");
        });

        // When
        String token = client.login(new LoginRequest.Token("provider-id-token", WALLET));

        // Then
        assertEquals("social:session-77", token);
        assertEquals("Bearer provider-id-token", authorization.get());
        assertEquals("{\"token\":\"provider-id-token\",\"walletAddress\":\"" + WALLET.value() + "\"}", body.get());
    }

    @Test
    void providerTokenIsKeptWhenBackendIssuesNone() {
        server.createContext(HttpBackendAuthClient.LOGIN_PATH, exchange -> respond(exchange, 200, "{\"ok\":true}"));

        assertEquals("provider-id-token", client.login(new LoginRequest.Token("provider-id-token", WALLET)));
    }

    @Test
    void logoutSendsBearer() {
        AtomicReference<String> authorization = new AtomicReference<>();
        AtomicReference<String> method = new AtomicReference<>();
        server.createContext(HttpBackendAuthClient.LOGOUT_PATH, exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            method.set(exchange.getRequestMethod());
            respond(exchange, 204, "");
        });

        client.logout("wallet:0xabc:1");

        assertEquals("Bearer wallet:0xabc:1", authorization.get());
        assertEquals("POST", method.get());
    }

    @Test
    void logoutFailureCarriesStatus() {
        server.createContext(HttpBackendAuthClient.LOGOUT_PATH,
                exchange -> respond(exchange, 401, "{\"error\":\"expired\"}"));

        BackendAuthException ex = assertThrows(BackendAuthException.class, () -> client.logout("wallet:0xabc:1"));

        assertEquals(401, ex.status());
        assertTrue(ex.getMessage().endsWith(": expired"));
    }

    @Test
    void unreachableBackendWrapsIoError() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        BackendAuthClient offline = HttpBackendAuthClient.builder("http://127.0.0.1:" + port)
                .connectTimeout(Duration.ofSeconds(1))
                .build();

        BackendAuthException ex = assertThrows(BackendAuthException.class, offline::fetchNonce);

        assertInstanceOf(IOException.class, ex.getCause());
    }

    private static void respond(final HttpExchange exchange, final int status, final String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        if (bytes.length == 0) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
