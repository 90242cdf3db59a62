package online.askahuman.tipme.gateway;

/**
 * Classification of an outbound payment attempt.
 */
public enum PaymentOutcome {

    /** The payment settled. */
    SUCCEEDED,

    /** The payment was rejected and no funds left the node; safe to retry. */
    FAILED,

    /**
     * The outcome is unknown (timeout, cancellation, in-flight). Funds may or may not
     * have been sent, so callers must never retry automatically.
     */
    AMBIGUOUS
}
