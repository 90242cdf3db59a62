package online.askahuman.tipme.lnurl;

/**
 * Base exception for LNURL and Lightning gateway errors.
 *
 * <p>Thrown when a remote party (a Lightning-address provider, an LNURL callback or the
 * payment gateway) fails, is unreachable, or answers with something that does not follow
 * the protocol. Invalid caller input is reported as {@link IllegalArgumentException}
 * instead.</p>
 */
public class LnurlException extends RuntimeException {

    /**
     * @param message human-readable description of the error
     */
    public LnurlException(String message) {
        super(message);
    }

    /**
     * @param message human-readable description of the error
     * @param cause   the underlying exception that triggered this error
     */
    public LnurlException(String message, Throwable cause) {
        super(message, cause);
    }
}
