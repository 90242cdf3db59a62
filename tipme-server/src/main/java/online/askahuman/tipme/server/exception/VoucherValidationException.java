package online.askahuman.tipme.server.exception;

/**
 * Malformed request input. Rejected before any state change; rendered as HTTP 400.
 */
public class VoucherValidationException extends RuntimeException {

    public VoucherValidationException(String message) {
        super(message);
    }
}
