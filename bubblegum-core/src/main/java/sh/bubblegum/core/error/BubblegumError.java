// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.error;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import sh.bubblegum.core.types.Address;

/**
 * Classified failure of a Bubblegum operation.
 *
 * <p>
 * Errors are values: every operation returns an {@link sh.bubblegum.core.Outcome} whose
 * failure side carries one of the records below. The hierarchy is sealed so callers can
 * branch on the kind with {@code instanceof}.
 *
 * <pre>
 * BubblegumError
 * ├── lifecycle:  {@link NotInitialized}, {@link AlreadyInitialized}
 * ├── input:      {@link InvalidArgument}
 * ├── asset data: {@link AssetNotFound}, {@link NotOwner}, {@link ProofUnavailable}, {@link NotCompressed}
 * ├── builder:    {@link BuildFailed}
 * ├── rpc:        {@link NetworkError}, {@link HttpError}, {@link RpcPayloadError}, {@link MalformedResponse}
 * └── submission: {@link InsufficientFunds}, {@link ExpiredBlockhash}, {@link UnknownSubmitFailure}, {@link SubmitFailed}
 * </pre>
 *
 * <p>
 * {@link #guidance()} returns a short remediation hint suitable for end users.
 *
 * @since 0.1.0
 */
public sealed interface BubblegumError {

    /**
     * Human-readable description of what failed.
     *
     * @return the message
     */
    String message();

    /**
     * What the caller can do about it.
     *
     * @return the remediation hint, empty when there is nothing useful to add
     */
    default String guidance() {
        return "";
    }

    /**
     * Short kind name, used in logs.
     *
     * @return the simple name of the error record
     */
    default String kind() {
        return getClass().getSimpleName();
    }

    /**
     * Whether this error came from the RPC layer (transport, HTTP or JSON-RPC payload).
     *
     * @return {@code true} for RPC-layer errors
     */
    default boolean isRpcError() {
        return this instanceof NetworkError
                || this instanceof HttpError
                || this instanceof RpcPayloadError
                || this instanceof MalformedResponse;
    }

    record NotInitialized() implements BubblegumError {
        @Override
        public String message() {
            return "Connection not established";
        }

        @Override
        public String guidance() {
            return "Initialize the connection with a secret key and RPC URL before calling any other operation.";
        }
    }

    record AlreadyInitialized() implements BubblegumError {
        @Override
        public String message() {
            return "Connection already established";
        }

        @Override
        public String guidance() {
            return "The connection can only be initialized once per process. "
                    + "Restart the application to use different connection details.";
        }
    }

    record InvalidArgument(String argument, String reason) implements BubblegumError {
        public InvalidArgument {
            Objects.requireNonNull(argument, "argument");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String message() {
            return "Invalid " + argument + ": " + reason;
        }
    }

    record AssetNotFound(String assetId) implements BubblegumError {
        @Override
        public String message() {
            return "Asset not found: " + assetId;
        }

        @Override
        public String guidance() {
            return "Check the asset id and make sure the RPC endpoint supports the DAS API.";
        }
    }

    record NotOwner(String assetId, Address expectedOwner, @Nullable String actualOwner) implements BubblegumError {
        @Override
        public String message() {
            return "Asset " + assetId + " is owned by " + actualOwner + ", not by " + expectedOwner;
        }

        @Override
        public String guidance() {
            return "Only the current owner can transfer a compressed asset.";
        }
    }

    record ProofUnavailable(String assetId) implements BubblegumError {
        @Override
        public String message() {
            return "No Merkle proof returned for asset " + assetId;
        }

        @Override
        public String guidance() {
            return "Check the asset id and make sure the RPC endpoint supports the DAS API.";
        }
    }

    record NotCompressed(String assetId, String detail) implements BubblegumError {
        @Override
        public String message() {
            return "Asset " + assetId + " has no usable compression data: " + detail;
        }

        @Override
        public String guidance() {
            return "The asset is not a compressed NFT, or the RPC response is not in the expected format.";
        }
    }

    record BuildFailed(String operation, Throwable cause) implements BubblegumError {
        public BuildFailed {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public String message() {
            return "Failed to build " + operation + " transaction: " + cause.getMessage();
        }

        @Override
        public String guidance() {
            return "Verify the secret key format and every address passed to the builder.";
        }
    }

    record NetworkError(Throwable cause) implements BubblegumError {
        public NetworkError {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public String message() {
            return "Network error during JSON-RPC call: " + cause;
        }

        @Override
        public String guidance() {
            return "Check connectivity to the RPC endpoint.";
        }
    }

    record HttpError(int status, @Nullable String body) implements BubblegumError {
        @Override
        public String message() {
            return "HTTP error " + status + (body == null || body.isBlank() ? "" : ": " + body);
        }
    }

    /**
     * The node answered with a JSON-RPC {@code error} object.
     *
     * @param code the JSON-RPC error code, {@code 0} when absent
     * @param errorMessage the error object's {@code message}, empty when absent
     * @param payload the full error object as returned by the node
     */
    record RpcPayloadError(int code, String errorMessage, JsonNode payload) implements BubblegumError {
        public RpcPayloadError {
            Objects.requireNonNull(errorMessage, "errorMessage");
            Objects.requireNonNull(payload, "payload");
        }

        public static RpcPayloadError from(final JsonNode error) {
            Objects.requireNonNull(error, "error");
            final int code = error.path("code").asInt(0);
            final String message = error.hasNonNull("message") ? error.get("message").asText() : error.toString();
            return new RpcPayloadError(code, message, error);
        }

        @Override
        public String message() {
            return "JSON-RPC error " + code + ": " + errorMessage;
        }
    }

    record MalformedResponse(String detail, @Nullable Throwable cause) implements BubblegumError {
        @Override
        public String message() {
            return "Malformed JSON-RPC response: " + detail;
        }
    }

    record InsufficientFunds(BubblegumError cause) implements BubblegumError {
        @Override
        public String message() {
            return "Insufficient funds: " + cause.message();
        }

        @Override
        public String guidance() {
            return "Add SOL to the wallet. Tree creation needs the rent-exempt balance for the tree account "
                    + "plus the transaction fee.";
        }
    }

    record ExpiredBlockhash(BubblegumError cause) implements BubblegumError {
        @Override
        public String message() {
            return "Transaction blockhash expired: " + cause.message();
        }

        @Override
        public String guidance() {
            return "Run the whole operation again; a fresh build fetches a fresh blockhash.";
        }
    }

    record UnknownSubmitFailure(BubblegumError cause) implements BubblegumError {
        @Override
        public String message() {
            return "Transaction submission failed: " + cause.message();
        }

        @Override
        public String guidance() {
            return "Check the connection and wallet status, then try again.";
        }
    }

    record SubmitFailed(BubblegumError cause) implements BubblegumError {
        @Override
        public String message() {
            return "Transaction submission failed: " + cause.message();
        }

        @Override
        public String guidance() {
            return "Possible causes: insufficient SOL for fees, a Merkle proof that went stale because the tree "
                    + "changed after it was fetched, or a concurrent transfer of the same asset. "
                    + "Restart the entire operation; do not resend the same transaction.";
        }
    }
}
