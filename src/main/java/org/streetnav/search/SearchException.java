package org.streetnav.search;

import lombok.Getter;

import java.util.Objects;

/**
 * Search contract failure with deterministic reason codes.
 *
 * <p>Unreachable goals and unknown node keys are not failures; they produce an unreachable
 * {@link PathResult}. This exception covers exhausted search budgets and broken internal
 * invariants.</p>
 */
@Getter
public final class SearchException extends RuntimeException {
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "SEARCH_BUDGET_EXCEEDED";
    public static final String REASON_PREDECESSOR_CYCLE = "PREDECESSOR_CYCLE";

    private final String reasonCode;

    /**
     * Creates a reason-coded search failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public SearchException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded search failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public SearchException(String reasonCode, String message, Throwable cause) {
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
