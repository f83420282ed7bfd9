package io.classguard.ingest.subscriber;

/**
 * The broker could not be reached, or the connection dropped mid-operation.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
