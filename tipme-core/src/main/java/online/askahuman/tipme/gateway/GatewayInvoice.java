package online.askahuman.tipme.gateway;

/**
 * Invoice issued by the payment gateway.
 *
 * @param paymentHash SHA-256 payment hash (hex); the gateway's idempotency key for the invoice
 * @param invoice     BOLT11-encoded payment request
 */
public record GatewayInvoice(String paymentHash, String invoice) {}
