package online.askahuman.tipme.server.service;

/**
 * Outcome of a refund to a Lightning address.
 *
 * @param outcome     classification driving the caller's follow-up
 * @param amountMsats amount actually invoiced, 0 when nothing was sent
 * @param detail      human-readable reason for logs
 */
public record RefundResult(Outcome outcome, long amountMsats, String detail) {

    public enum Outcome {
        /** Paid. */
        REFUNDED,
        /** Below the recipient's minimum; the gateway was never called. Not retried. */
        DUST,
        /** Definitively not paid: resolution, invoice request or payment rejected. */
        FAILED,
        /** The payment may or may not have gone through. */
        AMBIGUOUS
    }

    public static RefundResult refunded(long amountMsats) {
        return new RefundResult(Outcome.REFUNDED, amountMsats, "refunded");
    }

    public static RefundResult dust(String detail) {
        return new RefundResult(Outcome.DUST, 0, detail);
    }

    public static RefundResult failed(String detail) {
        return new RefundResult(Outcome.FAILED, 0, detail);
    }

    public static RefundResult ambiguous(long amountMsats, String detail) {
        return new RefundResult(Outcome.AMBIGUOUS, amountMsats, detail);
    }
}
