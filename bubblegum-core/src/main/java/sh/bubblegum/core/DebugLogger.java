// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for RPC and workflow tracing.
 *
 * <p>Messages are only emitted when the matching {@link BubblegumDebug} toggle is on,
 * and every message passes through {@link LogSanitizer} first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.bubblegum.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!BubblegumDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logTx(final String message, final Object... args) {
        if (!BubblegumDebug.isTxLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!BubblegumDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
