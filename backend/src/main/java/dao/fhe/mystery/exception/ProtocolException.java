package dao.fhe.mystery.exception;

import lombok.Getter;

/**
 * Thrown when an operation's preconditions do not hold. Raised before any state is mutated.
 */
@Getter
public class ProtocolException extends RuntimeException {

    private final ProtocolError error;

    public ProtocolException(ProtocolError error, String message) {
        super(message);
        this.error = error;
    }

    public ProtocolException(ProtocolError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
