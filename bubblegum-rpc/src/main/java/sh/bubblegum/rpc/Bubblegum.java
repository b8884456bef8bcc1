// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.bubblegum.core.ConnectionContext;
import sh.bubblegum.core.ConnectionState;
import sh.bubblegum.core.Outcome;
import sh.bubblegum.core.model.MintRequest;
import sh.bubblegum.core.types.Address;
import sh.bubblegum.core.types.TransactionSignature;

/**
 * Entry point wiring one {@link ConnectionContext}, one {@link RpcClient} and the three
 * workflow services together.
 *
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * try (Bubblegum bubblegum = Bubblegum.builder()
 *         .transactionBuilder(myBuilder)
 *         .readTimeout(Duration.ofSeconds(20))
 *         .build()) {
 *     bubblegum.connect(secretKeyBase58, "https://api.devnet.solana.com").orElseThrow();
 *     Address tree = bubblegum.createTree().orElseThrow();
 *     bubblegum.mint(tree.value(), "My NFT", "MNFT", "https://example.com/nft.json",
 *             creator, 500).orElseThrow();
 * }
 * }</pre>
 *
 * <p>
 * Every workflow returns an {@link Outcome}; nothing is retried. Calling methods on a
 * closed instance throws {@link IllegalStateException}.
 *
 * @see Bubblegum.Builder
 */
public final class Bubblegum implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Bubblegum.class);

    private final ConnectionContext context;
    private final RpcTransport transport;
    private final RpcClient rpc;
    private final TreeService trees;
    private final MintService mints;
    private final TransferService transfers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Bubblegum(final Builder builder) {
        this.context = new ConnectionContext();
        this.transport = builder.transport != null
                ? builder.transport
                : HttpRpcTransport.create(new RpcConfig(builder.connectTimeout, builder.readTimeout, builder.headers));
        this.rpc = new DefaultRpcClient(context, transport);
        this.trees = new TreeService(context, builder.transactionBuilder, rpc, builder.classifier);
        this.mints = new MintService(context, builder.transactionBuilder, rpc);
        this.transfers = new TransferService(context, builder.transactionBuilder, rpc, builder.listener);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Initializes the connection. Only the first successful call takes effect.
     *
     * @param secretKey   base58 secret key, 64-byte keypair or 32-byte seed
     * @param endpointUrl http(s) JSON-RPC endpoint
     * @return the stored state, or {@code InvalidArgument} / {@code AlreadyInitialized}
     */
    public Outcome<ConnectionState> connect(final String secretKey, final String endpointUrl) {
        ensureOpen();
        return context.initialize(secretKey, endpointUrl);
    }

    public Outcome<Address> createTree() {
        ensureOpen();
        return trees.createTree();
    }

    public Outcome<TransactionSignature> mint(
            final String treeAddress,
            final String name,
            final String symbol,
            final String uri,
            final String creatorAddress,
            final int royaltyShare) {
        ensureOpen();
        return mints.mint(treeAddress, name, symbol, uri, creatorAddress, royaltyShare);
    }

    public Outcome<TransactionSignature> mint(final MintRequest request) {
        ensureOpen();
        return mints.mint(request);
    }

    public Outcome<TransactionSignature> transfer(final String assetId, final String toAddress) {
        ensureOpen();
        return transfers.transfer(assetId, toAddress);
    }

    public ConnectionContext context() {
        return context;
    }

    public RpcClient rpc() {
        return rpc;
    }

    public TreeService trees() {
        return trees;
    }

    public MintService mints() {
        return mints;
    }

    public TransferService transfers() {
        return transfers;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Failed to close RPC transport", e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Bubblegum client is closed");
        }
    }

    /**
     * Builder for {@link Bubblegum}. A {@link TransactionBuilder} is required; everything
     * else has a default.
     */
    public static final class Builder {

        private @Nullable TransactionBuilder transactionBuilder;
        private @Nullable RpcTransport transport;
        private @Nullable Duration connectTimeout;
        private @Nullable Duration readTimeout;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private SubmitFailureClassifier classifier = SubmitFailureClassifier.defaults();
        private TransferListener listener = TransferListener.NONE;

        private Builder() {
        }

        public Builder transactionBuilder(final TransactionBuilder transactionBuilder) {
            this.transactionBuilder = transactionBuilder;
            return this;
        }

        /**
         * Uses a custom transport. Timeouts and headers set on this builder are then ignored.
         *
         * @param transport the transport
         * @return this builder
         */
        public Builder transport(final RpcTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder submitFailureClassifier(final SubmitFailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        public Builder transferListener(final TransferListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        /**
         * Builds the client.
         *
         * @return a new client with an uninitialized connection
         * @throws IllegalStateException if no transaction builder was set
         */
        public Bubblegum build() {
            if (transactionBuilder == null) {
                throw new IllegalStateException("transactionBuilder is required");
            }
            return new Bubblegum(this);
        }
    }
}
