package online.askahuman.tipme.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Public view of a voucher looked up by its pay id.
 */
public record VoucherSummaryResponse(
        @JsonProperty("active") boolean active,
        @JsonProperty("balance_sats") long balanceSats,
        @JsonProperty("expires_at") String expiresAt,
        @JsonProperty("funding_history") List<Funding> fundingHistory
) {

    public record Funding(
            @JsonProperty("paid_at") String paidAt,
            @JsonProperty("credited_sats") long creditedSats
    ) {}
}
