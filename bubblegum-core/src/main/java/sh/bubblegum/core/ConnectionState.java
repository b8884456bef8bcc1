// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core;

import java.net.URI;
import java.util.Objects;

import sh.bubblegum.core.crypto.Credential;

/**
 * The credential and RPC endpoint every operation runs against. Immutable.
 *
 * @param credential the signing credential
 * @param endpoint   the JSON-RPC endpoint; must support the DAS API
 */
public record ConnectionState(Credential credential, URI endpoint) {

    public ConnectionState {
        Objects.requireNonNull(credential, "credential");
        Objects.requireNonNull(endpoint, "endpoint");
    }

    @Override
    public String toString() {
        return "ConnectionState{address=" + credential.address() + ", endpoint=" + endpoint + "}";
    }
}
