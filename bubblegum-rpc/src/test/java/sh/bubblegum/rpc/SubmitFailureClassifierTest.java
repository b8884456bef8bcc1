// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import sh.bubblegum.core.error.BubblegumError;

class SubmitFailureClassifierTest {

    private final SubmitFailureClassifier classifier = SubmitFailureClassifier.defaults();

    private static BubblegumError.RpcPayloadError payload(final String message) {
        return new BubblegumError.RpcPayloadError(-32002, message, JsonNodeFactory.instance.objectNode());
    }

    @Test
    void insufficientFundsMarker() {
        BubblegumError.RpcPayloadError cause =
                payload("Transaction simulation failed: Error processing Instruction 0: custom program error: 0x1");

        BubblegumError classified = classifier.classify(cause);

        BubblegumError.InsufficientFunds funds = assertInstanceOf(BubblegumError.InsufficientFunds.class, classified);
        assertSame(cause, funds.cause());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Blockhash not found", "blockhash expired", "BLOCKHASH"})
    void expiredBlockhashIgnoresCase(final String message) {
        assertInstanceOf(BubblegumError.ExpiredBlockhash.class, classifier.classify(payload(message)));
    }

    @Test
    void firstMatchingRuleWins() {
        assertInstanceOf(BubblegumError.InsufficientFunds.class,
                classifier.classify(payload("0x1 and also Blockhash not found")));
    }

    @Test
    void unmatchedPayloadIsUnknown() {
        BubblegumError.RpcPayloadError cause = payload("account in use");

        BubblegumError.UnknownSubmitFailure unknown =
                assertInstanceOf(BubblegumError.UnknownSubmitFailure.class, classifier.classify(cause));
        assertSame(cause, unknown.cause());
    }

    @Test
    void transportFailuresAreNeverMatched() {
        BubblegumError http = new BubblegumError.HttpError(502, "blockhash 0x1");
        BubblegumError network = new BubblegumError.NetworkError(new IOException("refused"));

        assertSame(http, ((BubblegumError.UnknownSubmitFailure) classifier.classify(http)).cause());
        assertInstanceOf(BubblegumError.UnknownSubmitFailure.class, classifier.classify(network));
    }

    @Test
    void customRules() {
        SubmitFailureClassifier custom = new SubmitFailureClassifier(List.of(
                new SubmitFailureClassifier.Rule(Pattern.compile("account in use"),
                        BubblegumError.ExpiredBlockhash::new)));

        assertInstanceOf(BubblegumError.ExpiredBlockhash.class, custom.classify(payload("account in use")));
        assertInstanceOf(BubblegumError.UnknownSubmitFailure.class, custom.classify(payload("0x1")));
        assertEquals(1, custom.rules().size());
    }
}
