package org.Aayush.locus.pipeline;

import lombok.Getter;

import java.util.Objects;

/**
 * Pipeline contract failure with a deterministic reason code.
 */
@Getter
public final class NetworkPipelineException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded pipeline failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public NetworkPipelineException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded pipeline failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public NetworkPipelineException(String reasonCode, String message, Throwable cause) {
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
