// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RpcTransport} backed by {@link java.net.http.HttpClient}.
 *
 * <p>
 * Every request carries {@code Content-Type: application/json}, the configured extra
 * headers and the configured read timeout; the client applies the connect timeout.
 * A timeout surfaces as an {@link IOException} like any other transport failure.
 *
 * <pre>{@code
 * RpcTransport transport = HttpRpcTransport.builder()
 *         .connectTimeout(Duration.ofSeconds(5))
 *         .readTimeout(Duration.ofSeconds(20))
 *         .build();
 * }</pre>
 */
public final class HttpRpcTransport implements RpcTransport {

    private final RpcConfig config;
    private final HttpClient httpClient;

    private HttpRpcTransport(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HttpRpcTransport create(final RpcConfig config) {
        return new HttpRpcTransport(Objects.requireNonNull(config, "config"));
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public HttpReply post(final URI endpoint, final String jsonBody) throws IOException {
        final HttpRequest request = buildRequest(endpoint, jsonBody);
        try {
            final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return new HttpReply(response.statusCode(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            final InterruptedIOException interrupted = new InterruptedIOException("JSON-RPC call interrupted");
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private HttpRequest buildRequest(final URI endpoint, final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint)
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public HttpRpcTransport build() {
            return new HttpRpcTransport(new RpcConfig(connectTimeout, readTimeout, new LinkedHashMap<>(headers)));
        }
    }
}
