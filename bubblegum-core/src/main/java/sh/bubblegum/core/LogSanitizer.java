// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts secret keys and serialized transactions to prevent credential leakage</li>
 * <li>Truncates excessively long logs to prevent memory issues</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Logs exceeding this will be truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String REDACTED = "***[REDACTED]***";

    private static final Pattern SECRET_KEY_FIELD =
            Pattern.compile("\"(secretKey|privateKey|secret_key)\"\\s*:\\s*\"[^\"]*\"");

    // sendTransaction params: ["<base64 tx>", {"encoding":"base64"}]
    private static final Pattern TRANSACTION_PARAM =
            Pattern.compile("\"params\"\\s*:\\s*\\[\\s*\"[^\"]*\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("ecret") || sanitized.contains("rivate")) {
            sanitized = SECRET_KEY_FIELD.matcher(sanitized).replaceAll("\"$1\":\"" + REDACTED + "\"");
        }

        if (sanitized.contains("\"params\"")) {
            sanitized = TRANSACTION_PARAM.matcher(sanitized).replaceAll("\"params\":[\"" + REDACTED + "\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
