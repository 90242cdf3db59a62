package online.askahuman.tipme.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code {"status":"OK"}} or {@code {"status":"ERROR","reason":"..."}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LnurlStatusResponse(String status, String reason) implements LnurlResponse {

    public static LnurlStatusResponse ok() {
        return new LnurlStatusResponse("OK", null);
    }

    public static LnurlStatusResponse error(String reason) {
        return new LnurlStatusResponse("ERROR", reason);
    }

    public boolean isError() {
        return "ERROR".equals(status);
    }
}
