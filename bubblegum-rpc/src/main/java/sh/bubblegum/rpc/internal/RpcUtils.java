// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc.internal;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Internal helpers shared by the RPC layer.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance for JSON serialization/deserialization.
     * <p>
     * ObjectMapper is expensive to create and thread-safe after configuration,
     * so a single shared instance is used across all RPC classes.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Microseconds elapsed since a {@link System#nanoTime()} reading.
     */
    public static long elapsedMicros(final long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000L;
    }
}
