package online.askahuman.tipme.server.entity;

/**
 * Lifecycle of a {@link VoucherCreationRequest}. {@code COMPLETE} and {@code EXPIRED} are terminal.
 */
public enum CreationStatus {
    PENDING,
    COMPLETE,
    EXPIRED;

    /** Lower-case name used on the wire. */
    public String wireName() {
        return name().toLowerCase();
    }
}
