package online.askahuman.tipme.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreationInvoiceResponse(
        @JsonProperty("invoice") String invoice,
        @JsonProperty("payment_hash") String paymentHash,
        @JsonProperty("fee_sats") long feeSats
) {}
