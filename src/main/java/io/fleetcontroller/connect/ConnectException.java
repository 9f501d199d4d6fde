package io.fleetcontroller.connect;

import lombok.Getter;

/**
 * Typed failure of the connect protocol.
 */
@Getter
public class ConnectException extends Exception {

    private final ConnectError error;
    /** Tag of the current holder, only set for {@link ConnectError#KEY_HELD}. */
    private final String existingTag;

    public ConnectException(ConnectError error) {
        this(error, null, null);
    }

    public ConnectException(ConnectError error, Throwable cause) {
        this(error, null, cause);
    }

    public static ConnectException keyHeld(String existingTag) {
        return new ConnectException(ConnectError.KEY_HELD, existingTag, null);
    }

    private ConnectException(ConnectError error, String existingTag, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
        this.existingTag = existingTag;
    }
}
