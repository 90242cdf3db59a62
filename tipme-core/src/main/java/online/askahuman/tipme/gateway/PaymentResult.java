package online.askahuman.tipme.gateway;

/**
 * Result of {@link LightningGateway#payInvoice(String)}.
 *
 * @param outcome     how the attempt ended
 * @param paymentHash payment hash reported by the gateway, if any
 * @param reason      failure or ambiguity detail, null on success
 */
public record PaymentResult(PaymentOutcome outcome, String paymentHash, String reason) {

    public static PaymentResult succeeded(String paymentHash) {
        return new PaymentResult(PaymentOutcome.SUCCEEDED, paymentHash, null);
    }

    public static PaymentResult failed(String reason) {
        return new PaymentResult(PaymentOutcome.FAILED, null, reason);
    }

    public static PaymentResult ambiguous(String reason) {
        return new PaymentResult(PaymentOutcome.AMBIGUOUS, null, reason);
    }

    public boolean isSucceeded() {
        return outcome == PaymentOutcome.SUCCEEDED;
    }
}
