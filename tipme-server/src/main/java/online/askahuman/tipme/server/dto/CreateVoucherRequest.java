package online.askahuman.tipme.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateVoucherRequest(
        @JsonProperty("lightning_address") String lightningAddress,
        @JsonProperty("count") int count,
        @JsonProperty("expiry_seconds") long expirySeconds
) {}
