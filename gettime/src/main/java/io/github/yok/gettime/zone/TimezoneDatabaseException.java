package io.github.yok.gettime.zone;

/**
 * Signals that the timezone database rejected an anchor or shift operation.
 *
 * @author Yasuharu.Okawauchi
 */
public class TimezoneDatabaseException extends Exception {

    private static final long serialVersionUID = 1L;

    public TimezoneDatabaseException(String message) {
        super(message);
    }

    public TimezoneDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
