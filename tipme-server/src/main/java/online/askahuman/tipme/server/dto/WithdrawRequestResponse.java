package online.askahuman.tipme.server.dto;

/**
 * LNURL-withdraw first step (LUD-03). Min and max are both the full balance.
 */
public record WithdrawRequestResponse(
        String tag,
        String callback,
        String k1,
        String defaultDescription,
        long minWithdrawable,
        long maxWithdrawable
) implements LnurlResponse {

    public static WithdrawRequestResponse of(String callback, String k1, String defaultDescription,
                                             long balanceMsats) {
        return new WithdrawRequestResponse("withdrawRequest", callback, k1, defaultDescription,
                balanceMsats, balanceMsats);
    }
}
