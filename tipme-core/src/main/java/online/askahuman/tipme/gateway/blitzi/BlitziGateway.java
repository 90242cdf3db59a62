package online.askahuman.tipme.gateway.blitzi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import online.askahuman.tipme.gateway.GatewayInvoice;
import online.askahuman.tipme.gateway.LightningGateway;
import online.askahuman.tipme.gateway.PaymentResult;
import online.askahuman.tipme.lnurl.LnurlException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link LightningGateway} backed by a locally running Blitzi payment server.
 *
 * <ul>
 *   <li>{@code POST /invoice {amount_msats, description}} → {@code {payment_hash, invoice}}</li>
 *   <li>{@code GET /invoice/{payment_hash}} → {@code {payment_hash, paid}}</li>
 *   <li>{@code POST /pay {invoice}} → {@code {success, error}}</li>
 * </ul>
 *
 * <p>Requests carry {@code Authorization: Bearer <token>} when a token is configured.</p>
 */
public class BlitziGateway implements LightningGateway {

    private static final System.Logger log = System.getLogger(BlitziGateway.class.getName());

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration PAY_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String token;
    private final HttpClient httpClient;
    private final Duration pollInterval;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param baseUrl      Blitzi base URL, e.g. {@code http://localhost:3000}
     * @param token        bearer token, may be blank
     * @param httpClient   the HTTP client to use
     * @param pollInterval interval between settlement checks
     */
    public BlitziGateway(String baseUrl, String token, HttpClient httpClient, Duration pollInterval) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.httpClient = httpClient;
        this.pollInterval = pollInterval;
        this.objectMapper.deactivateDefaultTyping();
        log.log(System.Logger.Level.INFO, "BlitziGateway initialized for {0}", this.baseUrl);
    }

    /**
     * @param baseUrl      Blitzi base URL
     * @param token        bearer token, may be blank
     * @param pollInterval interval between settlement checks
     * @return a gateway with a default HttpClient
     */
    public static BlitziGateway create(String baseUrl, String token, Duration pollInterval) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        return new BlitziGateway(baseUrl, token, httpClient, pollInterval);
    }

    @Override
    public Duration pollInterval() {
        return pollInterval;
    }

    @Override
    public GatewayInvoice createInvoice(long amountMsats, String description) {
        try {
            String body = objectMapper.writeValueAsString(Map.of(
                    "amount_msats", amountMsats,
                    "description", description
            ));
            HttpResponse<String> response = send(post("/invoice", body, REQUEST_TIMEOUT));
            if (response.statusCode() >= 400) {
                throw new LnurlException("Blitzi POST /invoice returned HTTP " + response.statusCode()
                        + ": " + response.body());
            }
            InvoiceResponse invoice = objectMapper.readValue(response.body(), InvoiceResponse.class);
            if (invoice == null || isBlank(invoice.paymentHash()) || isBlank(invoice.invoice())) {
                throw new LnurlException("Incomplete Blitzi invoice response: " + response.body());
            }
            log.log(System.Logger.Level.INFO, "Created invoice: {0} msats, hash: {1}",
                    String.valueOf(amountMsats), invoice.paymentHash());
            return new GatewayInvoice(invoice.paymentHash(), invoice.invoice());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LnurlException("Blitzi request interrupted", e);
        } catch (IOException e) {
            throw new LnurlException("Blitzi invoice creation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isInvoicePaid(String paymentHash) {
        try {
            String path = "/invoice/" + URLEncoder.encode(paymentHash, StandardCharsets.UTF_8);
            HttpResponse<String> response = send(authorized(HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(REQUEST_TIMEOUT)
                    .GET()));
            if (response.statusCode() >= 400) {
                throw new LnurlException("Blitzi GET " + path + " returned HTTP " + response.statusCode());
            }
            InvoiceStatus status = objectMapper.readValue(response.body(), InvoiceStatus.class);
            return status != null && status.paid();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LnurlException("Blitzi request interrupted", e);
        } catch (IOException e) {
            throw new LnurlException("Blitzi invoice lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    public PaymentResult payInvoice(String bolt11) {
        HttpResponse<String> response;
        try {
            String body = objectMapper.writeValueAsString(Map.of("invoice", bolt11));
            response = send(post("/pay", body, PAY_TIMEOUT));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PaymentResult.ambiguous("payment interrupted before Blitzi answered");
        } catch (HttpTimeoutException e) {
            return PaymentResult.ambiguous("timed out waiting for Blitzi: " + e.getMessage());
        } catch (ConnectException e) {
            return PaymentResult.failed("Blitzi unreachable: " + e.getMessage());
        } catch (IOException e) {
            return PaymentResult.ambiguous("transport error during payment: " + e.getMessage());
        }

        if (response.statusCode() >= 400) {
            return PaymentResult.failed("Blitzi returned HTTP " + response.statusCode() + ": " + response.body());
        }

        PayResponse result;
        try {
            result = objectMapper.readValue(response.body(), PayResponse.class);
        } catch (IOException e) {
            // some Blitzi builds answer a successful payment with an empty body
            log.log(System.Logger.Level.DEBUG, "Unparseable /pay body treated as success: {0}", e.getMessage());
            return PaymentResult.succeeded(null);
        }
        if (result != null && !result.success() && !isBlank(result.error())) {
            return PaymentResult.failed("Blitzi pay error: " + result.error());
        }
        return PaymentResult.succeeded(null);
    }

    private HttpRequest post(String path, String json, Duration timeout) {
        return authorized(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json)));
    }

    private HttpRequest authorized(HttpRequest.Builder builder) {
        if (!isBlank(token)) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.build();
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InvoiceResponse(
            @JsonProperty("payment_hash") String paymentHash,
            @JsonProperty("invoice") String invoice
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InvoiceStatus(
            @JsonProperty("payment_hash") String paymentHash,
            @JsonProperty("paid") boolean paid
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PayResponse(
            @JsonProperty("success") boolean success,
            @JsonProperty("error") String error
    ) {}
}
