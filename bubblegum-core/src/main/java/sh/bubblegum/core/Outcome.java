// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

import sh.bubblegum.core.error.BubblegumError;
import sh.bubblegum.core.error.BubblegumException;

/**
 * Result of a Bubblegum operation: either a value or a classified error, never both.
 * <p>
 * This is a sealed interface with two implementations:
 * <ul>
 *   <li>{@link Ok} - the operation produced a value</li>
 *   <li>{@link Err} - the operation failed with a {@link BubblegumError}; the ordered
 *   {@code context} map carries diagnostics added along the way (asset id, parameters)</li>
 * </ul>
 *
 * <pre>{@code
 * Outcome<TransactionSignature> outcome = transferService.transfer(assetId, recipient);
 * if (outcome instanceof Outcome.Err<TransactionSignature> err
 *         && err.error() instanceof BubblegumError.NotOwner) {
 *     // ...
 * }
 * }</pre>
 *
 * @param <T> the success type
 * @since 0.1.0
 */
public sealed interface Outcome<T> {

    static <T> Outcome<T> ok(final T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> err(final BubblegumError error) {
        return new Err<>(error, Map.of());
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /**
     * The success value, or {@code null} for a failure.
     *
     * @return the value if present
     */
    @Nullable T valueOrNull();

    /**
     * The error, or {@code null} for a success.
     *
     * @return the error if present
     */
    @Nullable BubblegumError errorOrNull();

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    <U> Outcome<U> flatMap(Function<? super T, Outcome<U>> mapper);

    /**
     * Adds a diagnostic entry to a failure. Successes are returned unchanged.
     *
     * @param key   context key, e.g. {@code "assetId"}
     * @param value context value, rendered with {@link String#valueOf(Object)}
     * @return an outcome carrying the extra context
     */
    Outcome<T> withContext(String key, @Nullable Object value);

    /**
     * Returns the value, or throws {@link BubblegumException} carrying the error and context.
     *
     * @return the success value
     * @throws BubblegumException if this is a failure
     */
    T orElseThrow();

    record Ok<T>(T value) implements Outcome<T> {

        public Ok {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T valueOrNull() {
            return value;
        }

        @Override
        public @Nullable BubblegumError errorOrNull() {
            return null;
        }

        @Override
        public <U> Outcome<U> map(final Function<? super T, ? extends U> mapper) {
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(final Function<? super T, Outcome<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> withContext(final String key, final @Nullable Object value) {
            return this;
        }

        @Override
        public T orElseThrow() {
            return value;
        }
    }

    record Err<T>(BubblegumError error, Map<String, String> context) implements Outcome<T> {

        /**
         * Copies the context into an unmodifiable map.
         */
        public Err {
            Objects.requireNonNull(error, "error cannot be null");
            Objects.requireNonNull(context, "context cannot be null");
            context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public @Nullable T valueOrNull() {
            return null;
        }

        @Override
        public BubblegumError errorOrNull() {
            return error;
        }

        @Override
        public <U> Outcome<U> map(final Function<? super T, ? extends U> mapper) {
            return cast();
        }

        @Override
        public <U> Outcome<U> flatMap(final Function<? super T, Outcome<U>> mapper) {
            return cast();
        }

        @Override
        public Outcome<T> withContext(final String key, final @Nullable Object value) {
            Objects.requireNonNull(key, "key");
            final Map<String, String> extended = new LinkedHashMap<>(context);
            extended.put(key, String.valueOf(value));
            return new Err<>(error, extended);
        }

        @Override
        public T orElseThrow() {
            throw new BubblegumException(error, context);
        }

        /**
         * Re-types this failure for a different success type, keeping error and context.
         *
         * @param <U> the new success type
         * @return the same failure
         */
        public <U> Err<U> cast() {
            return new Err<>(error, context);
        }
    }
}
