package online.askahuman.tipme.server.exception;

/**
 * The payment gateway could not issue an invoice. Rendered as HTTP 502.
 */
public class GatewayUnavailableException extends RuntimeException {

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
