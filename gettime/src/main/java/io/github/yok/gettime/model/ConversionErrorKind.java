package io.github.yok.gettime.model;

/**
 * Failure categories reported by the conversion pipeline.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ConversionErrorKind {

    /** {@code gettime.default-db-timezone} is blank or not a known zone id. */
    INVALID_DB_TIMEZONE_CONFIG,

    /** {@code gettime.default-user-timezone} is blank. */
    INVALID_USER_TIMEZONE_CONFIG,

    /** A caller- or config-supplied zone id is not in the timezone database. */
    INVALID_TIMEZONE,

    /** No parser in the chain accepted the string. */
    UNPARSEABLE_TIMESTAMP,

    /** A slash-separated date reads differently as US and EU order. */
    AMBIGUOUS_TIMESTAMP,

    /** The input is none of the recognized timestamp shapes. */
    UNSUPPORTED_TIMESTAMP_FORMAT,

    /** A naive local date-time could not be anchored to the source zone. */
    DATETIME_CONVERSION_FAILED,

    /** A calendar date could not be anchored to the source zone. */
    DATE_CONVERSION_FAILED,

    /** Epoch seconds fall outside the representable range. */
    UNIX_CONVERSION_FAILED,

    /** Shifting an instant to the target zone failed. */
    TIMEZONE_CONVERSION_FAILED,

    /** The renderer failed on the format string. */
    FORMATTING_FAILED
}
