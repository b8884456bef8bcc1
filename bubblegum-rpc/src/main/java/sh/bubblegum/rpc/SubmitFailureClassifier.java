// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

import sh.bubblegum.core.error.BubblegumError;

/**
 * Maps a failed {@code sendTransaction} to a more specific error by matching the
 * JSON-RPC error message against a table of patterns.
 *
 * <p>
 * Default table, first match wins:
 * <table border="1">
 * <tr><th>Pattern</th><th>Result</th><th>Typical message</th></tr>
 * <tr><td>{@code 0x1}</td><td>{@code InsufficientFunds}</td>
 * <td>custom program error: 0x1</td></tr>
 * <tr><td>{@code blockhash} (any case)</td><td>{@code ExpiredBlockhash}</td>
 * <td>Transaction simulation failed: Blockhash not found</td></tr>
 * </table>
 * Anything else, including HTTP and network failures, becomes {@code UnknownSubmitFailure}.
 * The original error is always kept as the cause.
 *
 * <p>
 * Matching message text is brittle: {@code 0x1} also matches {@code 0x10} or
 * {@code 0x1771}. Callers that know better can pass their own rules, and the table should
 * give way to structured program error codes if the RPC ever exposes them.
 */
public final class SubmitFailureClassifier {

    /**
     * One row of the table.
     *
     * @param pattern  searched for in the RPC error message
     * @param classify wraps the original error into the classified one
     */
    public record Rule(Pattern pattern, Function<BubblegumError, BubblegumError> classify) {
        public Rule {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(classify, "classify");
        }
    }

    public static final Rule INSUFFICIENT_FUNDS =
            new Rule(Pattern.compile("0x1", Pattern.LITERAL), BubblegumError.InsufficientFunds::new);

    public static final Rule EXPIRED_BLOCKHASH =
            new Rule(Pattern.compile("blockhash", Pattern.CASE_INSENSITIVE), BubblegumError.ExpiredBlockhash::new);

    private static final SubmitFailureClassifier DEFAULT =
            new SubmitFailureClassifier(List.of(INSUFFICIENT_FUNDS, EXPIRED_BLOCKHASH));

    private final List<Rule> rules;

    public SubmitFailureClassifier(final List<Rule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public static SubmitFailureClassifier defaults() {
        return DEFAULT;
    }

    public List<Rule> rules() {
        return rules;
    }

    /**
     * Classifies a submission failure.
     *
     * @param submitError the error returned by {@link RpcClient#submit}
     * @return {@code InsufficientFunds}, {@code ExpiredBlockhash} (or whatever a custom rule
     *         produces) wrapping the input, otherwise {@code UnknownSubmitFailure}
     */
    public BubblegumError classify(final BubblegumError submitError) {
        Objects.requireNonNull(submitError, "submitError");
        if (submitError instanceof BubblegumError.RpcPayloadError payload) {
            for (Rule rule : rules) {
                if (rule.pattern().matcher(payload.errorMessage()).find()) {
                    return rule.classify().apply(payload);
                }
            }
        }
        return new BubblegumError.UnknownSubmitFailure(submitError);
    }
}
