// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.time.Duration;
import java.util.Map;

/**
 * Transport settings for {@link HttpRpcTransport}.
 * <p>
 * JSON-RPC itself defines no deadline, so both timeouts always have a value: a hung
 * endpoint would otherwise block a whole workflow indefinitely.
 *
 * @param connectTimeout TCP/TLS connect timeout
 * @param readTimeout    per-request timeout, from sending the request to receiving the full body
 * @param headers        extra HTTP headers (API keys, tracing)
 */
public record RpcConfig(
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public RpcConfig {
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive: " + connectTimeout);
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive: " + readTimeout);
        }
    }

    public static RpcConfig defaults() {
        return new RpcConfig(DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
