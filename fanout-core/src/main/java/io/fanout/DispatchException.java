package io.fanout;

/**
 * Thrown by {@link Channel#send} when a request fails as a whole before any recipient
 * was attempted, for example because the channel has been closed.
 *
 * <p>Failures tied to a single recipient are never thrown; they are reported in that
 * recipient's {@link DispatchResult}.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
