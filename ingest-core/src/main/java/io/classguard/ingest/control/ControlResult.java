package io.classguard.ingest.control;

/**
 * Outcome of a control request. Only authorization and device validation are
 * reported here; delivery to the classroom node happens afterwards.
 */
public enum ControlResult {
    SUCCESS("Success"),
    INVALID_DEVICE("Invalid device"),
    UNAUTHORIZED("Unauthorized");

    private final String message;

    ControlResult(String message) {
        this.message = message;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    public String getMessage() {
        return message;
    }
}
