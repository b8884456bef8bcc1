// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;

import sh.bubblegum.core.types.Address;
import sh.bubblegum.primitives.Base58;

/**
 * Ed25519 signing credential (wallet secret key) with address derivation.
 *
 * <p>
 * Accepted inputs, both base58 encoded:
 * <ul>
 * <li>64-byte keypair: 32-byte seed followed by the 32-byte public key. This is the
 * format exported by wallets and the Solana CLI. The embedded public key must match
 * the one derived from the seed.</li>
 * <li>32-byte seed on its own.</li>
 * </ul>
 *
 * <p>
 * The wallet {@link #address()} is derived from the seed with BouncyCastle's Ed25519
 * implementation. The credential never prints its secret; {@link #toString()} only shows
 * the address.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Credential credential = Credential.fromBase58(secretKey);
 * Address wallet = credential.address();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Credential implements Destroyable {

    private static final int SEED_SIZE = 32;
    private static final int KEYPAIR_SIZE = 64;

    private volatile byte[] keypair;
    private final Address address;
    private volatile boolean destroyed = false;

    private Credential(final byte[] keyBytes) {
        try {
            if (keyBytes.length != SEED_SIZE && keyBytes.length != KEYPAIR_SIZE) {
                throw new IllegalArgumentException(
                        "Secret key must be " + SEED_SIZE + " or " + KEYPAIR_SIZE + " bytes, got " + keyBytes.length);
            }
            final byte[] publicKey = derivePublicKey(keyBytes);
            if (keyBytes.length == KEYPAIR_SIZE
                    && !Arrays.equals(publicKey, Arrays.copyOfRange(keyBytes, SEED_SIZE, KEYPAIR_SIZE))) {
                throw new IllegalArgumentException("Secret key does not match its embedded public key");
            }
            final byte[] full = new byte[KEYPAIR_SIZE];
            System.arraycopy(keyBytes, 0, full, 0, SEED_SIZE);
            System.arraycopy(publicKey, 0, full, SEED_SIZE, SEED_SIZE);
            this.keypair = full;
            this.address = Address.fromBytes(publicKey);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a credential from a base58 secret key.
     *
     * @param secretKey base58 keypair (64 bytes) or seed (32 bytes)
     * @return the credential
     * @throws IllegalArgumentException if the text is not base58, has the wrong length,
     *                                  or carries a mismatching public key
     */
    public static Credential fromBase58(final String secretKey) {
        Objects.requireNonNull(secretKey, "secret key cannot be null");
        return new Credential(Base58.decode(secretKey.trim()));
    }

    /**
     * Creates a credential from raw key bytes. The input array is zeroed afterwards.
     *
     * @param keyBytes 64-byte keypair or 32-byte seed (will be zeroed after use)
     * @return the credential
     * @throws IllegalArgumentException if the bytes are invalid
     */
    public static Credential fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new Credential(keyBytes);
    }

    /**
     * The wallet address derived from the secret key.
     *
     * @return the public address
     */
    public Address address() {
        return address;
    }

    /**
     * The 64-byte keypair in base58, the form transaction builders accept.
     *
     * @return base58 secret keypair
     * @throws IllegalStateException if the credential has been destroyed
     */
    public String toBase58() {
        return Base58.encode(keypairBytes());
    }

    /**
     * A copy of the 64-byte keypair.
     *
     * @return seed followed by public key
     * @throws IllegalStateException if the credential has been destroyed
     */
    public byte[] keypairBytes() {
        final byte[] current = keypair;
        if (destroyed || current == null) {
            throw new IllegalStateException("Credential has been destroyed");
        }
        return current.clone();
    }

    @Override
    public void destroy() {
        final byte[] current = keypair;
        if (current != null) {
            Arrays.fill(current, (byte) 0);
        }
        keypair = null;
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "Credential{address=" + address + "}";
    }

    private static byte[] derivePublicKey(final byte[] keyBytes) {
        final Ed25519PrivateKeyParameters privateKey = new Ed25519PrivateKeyParameters(keyBytes, 0);
        return privateKey.generatePublicKey().getEncoded();
    }
}
