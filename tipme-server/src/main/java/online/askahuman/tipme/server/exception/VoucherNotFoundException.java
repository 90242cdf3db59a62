package online.askahuman.tipme.server.exception;

/**
 * Unknown pay id, withdraw id or creation payment hash. Rendered as HTTP 404.
 */
public class VoucherNotFoundException extends RuntimeException {

    public VoucherNotFoundException(String message) {
        super(message);
    }
}
