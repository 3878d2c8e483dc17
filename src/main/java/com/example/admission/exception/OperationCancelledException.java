package com.example.admission.exception;

/**
 * A backoff or rate-limit wait was aborted by shutdown or thread interruption.
 */
public class OperationCancelledException extends AdmissionException {

    public OperationCancelledException(String message) {
        super("CANCELLED", message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super("CANCELLED", message, cause);
    }
}
