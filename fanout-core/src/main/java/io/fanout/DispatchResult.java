package io.fanout;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Outcome of dispatching to a single recipient.
 *
 * <p>A {@link Status#SUCCESS} result carries the transport's response, a {@link Status#FAILED}
 * result carries an error message. Use the {@link #success} and {@link #failed} factories.
 *
 * @param status    whether delivery succeeded
 * @param recipient the recipient identifier exactly as passed to {@link Channel#send}
 * @param response  opaque transport response, {@code null} on failure
 * @param error     failure message, {@code null} on success
 */
public record DispatchResult(Status status, String recipient, Object response, String error) {

    public enum Status {
        SUCCESS,
        FAILED
    }

    public DispatchResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(recipient, "recipient");
        if (status == Status.SUCCESS && error != null) {
            throw new IllegalArgumentException("successful result cannot carry an error");
        }
        if (status == Status.FAILED && error == null) {
            throw new IllegalArgumentException("failed result must carry an error");
        }
    }

    public static DispatchResult success(String recipient, Object response) {
        return new DispatchResult(Status.SUCCESS, recipient, response, null);
    }

    public static DispatchResult failed(String recipient, String error) {
        return new DispatchResult(Status.FAILED, recipient, null, error);
    }

    /**
     * Creates a failed result from an exception. {@link CompletionException} and
     * {@link ExecutionException} wrappers are unwrapped; an exception without a message
     * is described by its class name.
     *
     * @param recipient the recipient identifier
     * @param error     the failure
     * @return a failed result
     */
    public static DispatchResult failed(String recipient, Throwable error) {
        return failed(recipient, describe(error));
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    static String describe(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }
}
