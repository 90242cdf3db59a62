package online.askahuman.tipme.lnurl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Resolves Lightning addresses to payable LNURL-pay endpoints (LUD-16 over LUD-06).
 *
 * <p>Protocol flow:</p>
 * <ol>
 *   <li>Split the address {@code user@domain}</li>
 *   <li>Fetch {@code https://domain/.well-known/lnurlp/user}</li>
 *   <li>Read {@code callback}, {@code minSendable} and {@code maxSendable}</li>
 *   <li>Request an invoice: {@code GET {callback}?amount={millisats}}</li>
 * </ol>
 *
 * <p>Pure Java: {@link java.net.http.HttpClient} for HTTP, Jackson for JSON.</p>
 */
public class LightningAddressResolver {

    private static final System.Logger log = System.getLogger(LightningAddressResolver.class.getName());

    private static final Pattern ADDRESS_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+\\-]+@[a-zA-Z0-9.\\-]+\\.[a-zA-Z]{2,}$");

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    /**
     * @param httpClient     the HTTP client used for provider requests
     * @param requestTimeout per-request timeout
     */
    public LightningAddressResolver(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.deactivateDefaultTyping();
    }

    /**
     * Creates a resolver with a default HttpClient.
     *
     * @param requestTimeout connect and per-request timeout
     * @return a new resolver
     */
    public static LightningAddressResolver create(Duration requestTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        return new LightningAddressResolver(httpClient, requestTimeout);
    }

    /**
     * Checks the {@code user@domain.tld} shape of a Lightning address. No network access.
     *
     * @param address candidate address, may be null
     * @return true if the address is well-formed
     */
    public static boolean isValidAddress(String address) {
        return address != null && ADDRESS_PATTERN.matcher(address).matches();
    }

    /**
     * Fetch the LNURL-pay parameters a Lightning address advertises.
     *
     * @param lightningAddress address in the form {@code user@domain}
     * @return the callback and sendable bounds
     * @throws IllegalArgumentException if the address is malformed
     * @throws LnurlException           if the provider is unreachable or answers malformed data
     */
    public PayParams resolve(String lightningAddress) {
        if (!isValidAddress(lightningAddress)) {
            throw new IllegalArgumentException(
                    "Invalid Lightning address format: must be username@domain.tld");
        }
        String[] parts = lightningAddress.split("@");
        String username = parts[0];
        String domain = parts[1];

        String endpointUrl = "https://" + domain + "/.well-known/lnurlp/" + username;
        log.log(System.Logger.Level.DEBUG, "Fetching LNURL-pay endpoint: {0}", endpointUrl);

        String body = get(endpointUrl, "LNURL-pay endpoint");
        PayEndpoint endpoint = parse(body, PayEndpoint.class, "LNURL-pay endpoint");

        if ("ERROR".equalsIgnoreCase(endpoint.getStatus())) {
            throw new LnurlException("LNURL-pay endpoint error for " + lightningAddress + ": " + endpoint.getReason());
        }
        if (endpoint.getCallback() == null || endpoint.getCallback().isBlank()) {
            throw new LnurlException("Empty callback from " + lightningAddress);
        }
        if (endpoint.getTag() != null && !"payRequest".equals(endpoint.getTag())) {
            throw new LnurlException(
                    "Invalid LNURL-pay tag: expected 'payRequest', got '" + endpoint.getTag() + "'");
        }

        // Callback may live on any host (LUD-06 allows it) but must be HTTPS
        URI callbackUri;
        try {
            callbackUri = URI.create(endpoint.getCallback());
        } catch (IllegalArgumentException e) {
            throw new LnurlException("Malformed LNURL-pay callback URL: " + endpoint.getCallback(), e);
        }
        if (!"https".equals(callbackUri.getScheme())) {
            throw new LnurlException("LNURL-pay callback URL must use HTTPS scheme");
        }
        if (callbackUri.getHost() == null || callbackUri.getHost().isBlank()) {
            throw new LnurlException("LNURL-pay callback URL has no host: " + endpoint.getCallback());
        }

        log.log(System.Logger.Level.DEBUG, "Resolved {0}: min={1} max={2} msats",
                lightningAddress, String.valueOf(endpoint.getMinSendable()),
                String.valueOf(endpoint.getMaxSendable()));
        return new PayParams(endpoint.getCallback(), endpoint.getMinSendable(), endpoint.getMaxSendable());
    }

    /**
     * Ask an LNURL-pay callback for a BOLT11 invoice.
     *
     * @param callback    callback URL from {@link #resolve}
     * @param amountMsats amount in millisatoshis
     * @return the BOLT11 payment request
     * @throws LnurlException if the callback fails, reports an error or returns no invoice
     */
    public String requestInvoice(String callback, long amountMsats) {
        String separator = callback.contains("?") ? "&" : "?";
        String invoiceUrl = callback + separator + "amount=" + amountMsats;
        log.log(System.Logger.Level.DEBUG, "Requesting invoice: {0}", invoiceUrl);

        String body = get(invoiceUrl, "LNURL-pay callback");
        InvoiceResponse invoice = parse(body, InvoiceResponse.class, "LNURL-pay callback");

        if ("ERROR".equalsIgnoreCase(invoice.getStatus())) {
            throw new LnurlException("LNURL-pay callback error: " + invoice.getReason());
        }
        if (invoice.getPr() == null || invoice.getPr().isBlank()) {
            throw new LnurlException("Empty invoice from LNURL-pay callback");
        }
        return invoice.getPr();
    }

    private String get(String url, String what) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new LnurlException(what + " returned HTTP " + response.statusCode());
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LnurlException(what + " request interrupted", e);
        } catch (IOException e) {
            throw new LnurlException(what + " request failed: " + e.getMessage(), e);
        }
    }

    private <T> T parse(String body, Class<T> type, String what) {
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new LnurlException("Empty " + what + " response");
            }
            return value;
        } catch (IOException e) {
            throw new LnurlException("Malformed " + what + " response: " + e.getMessage(), e);
        }
    }

    /**
     * Payable endpoint advertised by a Lightning address.
     *
     * @param callback    LNURL-pay callback URL
     * @param minSendable minimum amount in millisatoshis
     * @param maxSendable maximum amount in millisatoshis
     */
    public record PayParams(String callback, long minSendable, long maxSendable) {}

    /**
     * LNURL-pay endpoint response.
     * See: <a href="https://github.com/lnurl/luds/blob/luds/06.md">LUD-06</a>
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PayEndpoint {
        @JsonProperty("callback")
        private String callback;

        @JsonProperty("minSendable")
        private long minSendable;

        @JsonProperty("maxSendable")
        private long maxSendable;

        @JsonProperty("tag")
        private String tag;

        @JsonProperty("status")
        private String status;

        @JsonProperty("reason")
        private String reason;

        PayEndpoint() {}

        String getCallback() { return callback; }
        long getMinSendable() { return minSendable; }
        long getMaxSendable() { return maxSendable; }
        String getTag() { return tag; }
        String getStatus() { return status; }
        String getReason() { return reason; }
    }

    /**
     * LNURL-pay callback response.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class InvoiceResponse {
        @JsonProperty("pr")
        private String pr;

        @JsonProperty("status")
        private String status;

        @JsonProperty("reason")
        private String reason;

        InvoiceResponse() {}

        String getPr() { return pr; }
        String getStatus() { return status; }
        String getReason() { return reason; }
    }
}
