package io.classguard.ingest.codec;

/**
 * An inbound payload that cannot be turned into a reading or acknowledgement.
 */
public class DecodeException extends Exception {

    public enum Kind {
        /** Empty, oversized or syntactically invalid bytes. */
        MALFORMED_PAYLOAD,
        /** Valid JSON that is not an object, so no reading can be mapped from it. */
        MISSING_REQUIRED_FIELD
    }

    private final Kind kind;

    public DecodeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DecodeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
