package io.github.yok.gettime.model;

import com.google.common.base.Preconditions;
import java.util.NoSuchElementException;
import java.util.function.Function;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of a conversion stage: either a value or a {@link ConversionError}, never both.
 *
 * @param <T> success value type
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConversionResult<T> {

    private final T value;
    private final ConversionError error;

    /**
     * Creates a successful result.
     *
     * @param <T> value type
     * @param value success value
     * @return result
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static <T> ConversionResult<T> ok(T value) {
        return new ConversionResult<>(Preconditions.checkNotNull(value, "value"), null);
    }

    /**
     * Creates a failed result.
     *
     * @param <T> value type
     * @param error failure
     * @return result
     * @throws NullPointerException if {@code error} is {@code null}
     */
    public static <T> ConversionResult<T> failure(ConversionError error) {
        return new ConversionResult<>(null, Preconditions.checkNotNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * Returns the success value.
     *
     * @return value
     * @throws NoSuchElementException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present: " + error);
        }
        return value;
    }

    /**
     * Returns the failure.
     *
     * @return error
     * @throws NoSuchElementException if this result is a success
     */
    public ConversionError getError() {
        if (error == null) {
            throw new NoSuchElementException("No error present");
        }
        return error;
    }

    /**
     * Applies the next stage on success; a failure is passed through untouched.
     *
     * @param <R> next value type
     * @param next next stage
     * @return result of {@code next}, or this failure
     */
    public <R> ConversionResult<R> flatMap(Function<? super T, ConversionResult<R>> next) {
        if (error != null) {
            return failure(error);
        }
        return next.apply(value);
    }

    @Override
    public String toString() {
        return error == null ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
