package org.Aayush.ontology.resolver;

import lombok.Getter;

import java.util.Objects;

/**
 * Resolver contract failure with a deterministic reason code.
 *
 * <p>Raised only for invalid construction input; a value that cannot be resolved yields an
 * empty result instead.</p>
 */
@Getter
public final class ResolutionException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded resolver failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public ResolutionException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded resolver failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public ResolutionException(String reasonCode, String message, Throwable cause) {
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
