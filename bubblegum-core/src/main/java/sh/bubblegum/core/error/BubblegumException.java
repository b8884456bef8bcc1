// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.error;

import java.util.Map;
import java.util.Objects;

/**
 * Unchecked exception carrying a {@link BubblegumError}.
 *
 * <p>
 * The library reports failures as {@link sh.bubblegum.core.Outcome} values and never
 * throws this itself. It exists for callers that prefer exceptions at their own boundary:
 *
 * <pre>{@code
 * try {
 *     TransactionSignature sig = bubblegum.transfer(assetId, recipient).orElseThrow();
 * } catch (BubblegumException e) {
 *     if (e.error() instanceof BubblegumError.NotOwner) {
 *         // ...
 *     }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public class BubblegumException extends RuntimeException {

    private final BubblegumError error;
    private final Map<String, String> context;

    public BubblegumException(final BubblegumError error, final Map<String, String> context) {
        super(describe(error, context), causeOf(error));
        this.error = error;
        this.context = Map.copyOf(context);
    }

    public BubblegumError error() {
        return error;
    }

    public Map<String, String> context() {
        return context;
    }

    private static String describe(final BubblegumError error, final Map<String, String> context) {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(context, "context");
        final StringBuilder sb = new StringBuilder(error.message());
        if (!context.isEmpty()) {
            sb.append(' ').append(context);
        }
        if (!error.guidance().isEmpty()) {
            sb.append(". ").append(error.guidance());
        }
        return sb.toString();
    }

    private static Throwable causeOf(final BubblegumError error) {
        if (error instanceof BubblegumError.BuildFailed buildFailed) {
            return buildFailed.cause();
        }
        if (error instanceof BubblegumError.NetworkError networkError) {
            return networkError.cause();
        }
        if (error instanceof BubblegumError.MalformedResponse malformed) {
            return malformed.cause();
        }
        return null;
    }
}
