package io.github.yok.gettime.model;

import com.google.common.base.Preconditions;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Typed failure of a conversion stage.
 *
 * <p>
 * {@code value} holds the offending input (raw timestamp string or zone id) when the stage has one;
 * {@code detail} holds the reason reported by the failing collaborator.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConversionError {

    private final ConversionErrorKind kind;
    private final Object value;
    private final String detail;

    /**
     * Creates an error with neither value nor detail.
     *
     * @param kind error kind
     * @return error
     */
    public static ConversionError of(ConversionErrorKind kind) {
        return new ConversionError(Preconditions.checkNotNull(kind, "kind"), null, null);
    }

    /**
     * Creates an error carrying the offending value.
     *
     * @param kind error kind
     * @param value offending value
     * @return error
     */
    public static ConversionError withValue(ConversionErrorKind kind, Object value) {
        return new ConversionError(Preconditions.checkNotNull(kind, "kind"), value, null);
    }

    /**
     * Creates an error carrying the offending value and a reason.
     *
     * @param kind error kind
     * @param value offending value, may be {@code null}
     * @param detail reason text
     * @return error
     */
    public static ConversionError withDetail(ConversionErrorKind kind, Object value,
            String detail) {
        return new ConversionError(Preconditions.checkNotNull(kind, "kind"), value, detail);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (value != null) {
            sb.append(" value=").append(value);
        }
        if (detail != null) {
            sb.append(" detail=").append(detail);
        }
        return sb.toString();
    }
}
