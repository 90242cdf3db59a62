package online.askahuman.tipme.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Status of a creation request. Vouchers are only listed once the request is complete.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreationStatusResponse(
        @JsonProperty("status") String status,
        @JsonProperty("vouchers") List<VoucherLinksResponse> vouchers
) {

    public record VoucherLinksResponse(
            @JsonProperty("lnurl_pay") String lnurlPay,
            @JsonProperty("lnurl_withdraw") String lnurlWithdraw,
            @JsonProperty("lightning_address") String lightningAddress,
            @JsonProperty("absolute_expiry") String absoluteExpiry,
            @JsonProperty("relative_expiry_seconds") long relativeExpirySeconds
    ) {}
}
