// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.session;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

import sh.conduit.rpc.RpcRetryConfig;
import sh.conduit.session.auth.SignInMessage;
import sh.conduit.wallet.tx.GasPolicy;
import sh.conduit.wallet.tx.RetryPolicy;

/**
 * Settings for a {@link SessionManager}.
 *
 * @param chainId        chain the session is bound to; a wallet on another chain is asked to switch
 * @param domain         host placed in the sign-in message
 * @param uri            origin placed in the sign-in message
 * @param statement      statement placed in the sign-in message
 * @param connectTimeout how long a wallet connect may take
 * @param allowLazyAuth  whether the backend's lazy-auth nonce is honoured; off by default
 * @param readRetry      transient retry for trusted-endpoint reads
 * @param gasPolicy      gas rules for submitted transactions
 * @param retryPolicy    polling policy for reconciliation and submission retries
 */
public record SessionConfig(
        long chainId,
        String domain,
        URI uri,
        String statement,
        Duration connectTimeout,
        boolean allowLazyAuth,
        RpcRetryConfig readRetry,
        GasPolicy gasPolicy,
        RetryPolicy retryPolicy) {

    public SessionConfig {
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive, got: " + chainId);
        }
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readRetry, "readRetry");
        Objects.requireNonNull(gasPolicy, "gasPolicy");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
    }

    public static Builder builder(final long chainId) {
        return new Builder(chainId);
    }

    public static final class Builder {
        private final long chainId;
        private String domain = "localhost";
        private URI uri = URI.create("http://localhost");
        private String statement = SignInMessage.DEFAULT_STATEMENT;
        private Duration connectTimeout = Duration.ofSeconds(60);
        private boolean allowLazyAuth;
        private RpcRetryConfig readRetry = RpcRetryConfig.defaults();
        private GasPolicy gasPolicy = GasPolicy.builder().build();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();

        private Builder(final long chainId) {
            this.chainId = chainId;
        }

        public Builder domain(final String domain) {
            this.domain = domain;
            return this;
        }

        public Builder uri(final URI uri) {
            this.uri = uri;
            return this;
        }

        public Builder statement(final String statement) {
            this.statement = statement;
            return this;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder allowLazyAuth(final boolean allowLazyAuth) {
            this.allowLazyAuth = allowLazyAuth;
            return this;
        }

        public Builder readRetry(final RpcRetryConfig readRetry) {
            this.readRetry = readRetry;
            return this;
        }

        public Builder gasPolicy(final GasPolicy gasPolicy) {
            this.gasPolicy = gasPolicy;
            return this;
        }

        public Builder retryPolicy(final RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(chainId, domain, uri, statement, connectTimeout, allowLazyAuth,
                    readRetry, gasPolicy, retryPolicy);
        }
    }
}
