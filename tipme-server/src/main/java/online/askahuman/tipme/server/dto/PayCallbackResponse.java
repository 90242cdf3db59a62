package online.askahuman.tipme.server.dto;

import java.util.List;

/**
 * LNURL-pay callback answer carrying the funding invoice.
 */
public record PayCallbackResponse(String pr, List<Object> routes) implements LnurlResponse {

    public static PayCallbackResponse of(String pr) {
        return new PayCallbackResponse(pr, List.of());
    }
}
