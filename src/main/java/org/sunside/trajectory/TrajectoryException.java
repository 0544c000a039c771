package org.sunside.trajectory;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base trajectory-engine failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with {@code [REASON_CODE]} so callers can log or render
 * failures without inspecting the concrete subtype.</p>
 */
@Getter
@Accessors(fluent = true)
public class TrajectoryException extends RuntimeException {
    public static final String REASON_REQUEST_FIELD_REQUIRED = "TB_REQUEST_FIELD_REQUIRED";

    private final String reasonCode;

    /**
     * Creates a reason-coded trajectory failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public TrajectoryException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded trajectory failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public TrajectoryException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
