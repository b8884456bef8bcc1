// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.io.IOException;
import java.net.URI;

/**
 * Sends one JSON request body to an endpoint with HTTP POST.
 *
 * <p>
 * This is the seam between {@link RpcClient} and the network. It knows nothing about
 * JSON-RPC: classification of status codes and bodies happens in {@link DefaultRpcClient}.
 * Implementations must be thread-safe and must enforce their own timeouts.
 *
 * <p>
 * <strong>Built-in Implementations:</strong>
 * <ul>
 * <li>{@link HttpRpcTransport} - {@code java.net.http} transport (default)</li>
 * </ul>
 */
public interface RpcTransport extends AutoCloseable {

    /**
     * Posts a JSON body and returns whatever the server answered, whatever the status.
     *
     * @param endpoint the JSON-RPC endpoint
     * @param jsonBody the serialized request
     * @return the HTTP status and body
     * @throws IOException if the request could not be completed (connection refused,
     *                     DNS failure, timeout, interruption)
     */
    HttpReply post(URI endpoint, String jsonBody) throws IOException;

    /**
     * Releases transport resources. The default does nothing.
     */
    @Override
    default void close() {
        // Default no-op for transports that don't need cleanup
    }
}
