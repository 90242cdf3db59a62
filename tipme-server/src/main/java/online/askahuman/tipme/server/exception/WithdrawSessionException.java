package online.askahuman.tipme.server.exception;

/**
 * A withdraw callback presented a k1 that cannot be consumed. Every reason maps to the same
 * LNURL error for the wallet; the reason only drives logging.
 */
public class WithdrawSessionException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        MISMATCH,
        ALREADY_USED
    }

    private final Reason reason;

    public WithdrawSessionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
