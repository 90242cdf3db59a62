package online.askahuman.tipme.server.dto;

/**
 * LNURL-pay first step (LUD-06).
 */
public record PayRequestResponse(
        String tag,
        String callback,
        long minSendable,
        long maxSendable,
        String metadata
) implements LnurlResponse {

    public static PayRequestResponse of(String callback, long minSendable, long maxSendable, String metadata) {
        return new PayRequestResponse("payRequest", callback, minSendable, maxSendable, metadata);
    }
}
