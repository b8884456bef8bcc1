// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

/** Fixed keys and addresses used across the rpc tests. */
final class TestKeys {

    /** RFC 8032 test 1 keypair (seed followed by public key), base58. */
    static final String SECRET_KEY =
            "49W385L4rePHy6PAaQUovbD2aacgN4HsKXSMeUzRg4fmwXszN91JuMFrQRj3vMDpZuRF3ZknQBuRBoWQJEfXstMw";

    /** Address derived from {@link #SECRET_KEY}. */
    static final String OWNER = "FVen3X669xLzsi6N2V91DoiyzHzg1uAgqiT8jZ9nS96Z";

    /** RFC 8032 test 2 public key. */
    static final String OTHER_OWNER = "586Z7H2vpX9qNhN2T4e9Utugie3ogjbxzGaMtM3E6HR5";

    static final String RECIPIENT = "7kuT1dfMhUysWcLEV1eYk8ir7RTjszHmsUdrrPQNThcv";
    static final String TREE = "9WzDXyMrFftHVK4jBUEcqABUVVjLPCT9keST9ycxL22F";
    static final String ASSET_ID = "4mKSoDDqApmF1DqXvVTSL7sGe1pCP2q6KomxEsYQMgZX";

    private TestKeys() {
    }
}
