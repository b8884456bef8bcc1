// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.bubblegum.core.crypto.Credential;
import sh.bubblegum.core.error.BubblegumError;

/**
 * Write-once holder of the {@link ConnectionState} shared by every service.
 *
 * <p>
 * Create one context per process and pass it to the services that need it. The first
 * successful {@link #initialize} wins; every later call returns
 * {@link BubblegumError.AlreadyInitialized} and leaves the stored state untouched. There is
 * no way to update or reset the connection.
 *
 * <p>
 * <strong>Thread Safety:</strong> initialization is a compare-and-set, so exactly one of
 * several concurrent first callers succeeds. Reads need no locking because the state is
 * immutable once published.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ConnectionContext context = new ConnectionContext();
 * context.initialize(secretKey, "https://mainnet.helius-rpc.com/?api-key=...").orElseThrow();
 * Address wallet = context.credential().orElseThrow().address();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ConnectionContext {

    private static final Logger log = LoggerFactory.getLogger(ConnectionContext.class);

    private final AtomicReference<@Nullable ConnectionState> state = new AtomicReference<>();

    /**
     * Stores the connection state, once.
     *
     * @param credential the signing credential
     * @param endpoint   the JSON-RPC endpoint
     * @return the stored state, or {@link BubblegumError.AlreadyInitialized}
     */
    public Outcome<ConnectionState> initialize(final Credential credential, final URI endpoint) {
        Objects.requireNonNull(credential, "credential");
        Objects.requireNonNull(endpoint, "endpoint");
        final ConnectionState candidate = new ConnectionState(credential, endpoint);
        if (!state.compareAndSet(null, candidate)) {
            log.warn("Rejected second connection initialization; keeping {}", state.get());
            return Outcome.err(new BubblegumError.AlreadyInitialized());
        }
        log.debug("Connection initialized for {}", candidate);
        return Outcome.ok(candidate);
    }

    /**
     * Parses a base58 secret key and an endpoint URL, then stores them.
     * <p>
     * Once initialized, every call returns {@link BubblegumError.AlreadyInitialized} whatever
     * the arguments. Before that, an unparsable key or URL yields
     * {@link BubblegumError.InvalidArgument} and does not use up the one-time initialization.
     *
     * @param secretKey   base58 secret key (64-byte keypair or 32-byte seed)
     * @param endpointUrl http(s) URL of a DAS-capable RPC endpoint
     * @return the stored state, or the failure
     */
    public Outcome<ConnectionState> initialize(final String secretKey, final String endpointUrl) {
        if (isInitialized()) {
            return Outcome.err(new BubblegumError.AlreadyInitialized());
        }
        if (secretKey == null || secretKey.isBlank()) {
            return Outcome.err(new BubblegumError.InvalidArgument("secretKey", "must be a non-empty base58 string"));
        }
        final Credential credential;
        try {
            credential = Credential.fromBase58(secretKey);
        } catch (IllegalArgumentException e) {
            return Outcome.err(new BubblegumError.InvalidArgument("secretKey", e.getMessage()));
        }
        final Outcome<URI> endpoint = parseEndpoint(endpointUrl);
        if (endpoint instanceof Outcome.Err<URI> err) {
            credential.destroy();
            return err.cast();
        }
        final Outcome<ConnectionState> stored = initialize(credential, endpoint.orElseThrow());
        if (stored.isErr()) {
            credential.destroy();
        }
        return stored;
    }

    public boolean isInitialized() {
        return state.get() != null;
    }

    public Outcome<ConnectionState> state() {
        final ConnectionState current = state.get();
        return current == null ? Outcome.err(new BubblegumError.NotInitialized()) : Outcome.ok(current);
    }

    public Outcome<Credential> credential() {
        return state().map(ConnectionState::credential);
    }

    public Outcome<URI> endpoint() {
        return state().map(ConnectionState::endpoint);
    }

    static Outcome<URI> parseEndpoint(final String endpointUrl) {
        if (endpointUrl == null || endpointUrl.isBlank()) {
            return Outcome.err(new BubblegumError.InvalidArgument("endpoint", "must be a non-empty URL"));
        }
        final URI uri;
        try {
            uri = new URI(endpointUrl.trim());
        } catch (URISyntaxException e) {
            return Outcome.err(new BubblegumError.InvalidArgument("endpoint", e.getMessage()));
        }
        final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return Outcome.err(new BubblegumError.InvalidArgument("endpoint", "must be an http or https URL: " + endpointUrl));
        }
        if (uri.getHost() == null) {
            return Outcome.err(new BubblegumError.InvalidArgument("endpoint", "missing host: " + endpointUrl));
        }
        return Outcome.ok(uri);
    }
}
