// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

/**
 * Raw HTTP response as seen by the JSON-RPC client.
 *
 * @param statusCode HTTP status code
 * @param body       response body, empty string when there is none
 */
public record HttpReply(int statusCode, String body) {

    public HttpReply {
        body = body == null ? "" : body;
    }
}
