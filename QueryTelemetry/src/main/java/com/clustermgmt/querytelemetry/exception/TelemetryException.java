package com.clustermgmt.querytelemetry.exception;

/**
 * Exception raised by the telemetry engine, tagged with its {@link ErrorKind}.
 */
public class TelemetryException extends RuntimeException {

    private final ErrorKind kind;

    public TelemetryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TelemetryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static TelemetryException sourceUnavailable(long targetId, String reason, Throwable cause) {
        return new TelemetryException(ErrorKind.SOURCE_UNAVAILABLE,
                "Telemetry source unavailable for target " + targetId + ": " + reason, cause);
    }

    public static TelemetryException sessionConflict(String message) {
        return new TelemetryException(ErrorKind.SESSION_STATE_CONFLICT, message);
    }

    public static TelemetryException invalidClassification(String message) {
        return new TelemetryException(ErrorKind.INVALID_CLASSIFICATION, message);
    }
}
