package online.askahuman.tipme.gateway.lnd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import online.askahuman.tipme.gateway.GatewayInvoice;
import online.askahuman.tipme.gateway.LightningGateway;
import online.askahuman.tipme.gateway.PaymentResult;
import online.askahuman.tipme.lnurl.LnurlException;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.KeyStore;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Map;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * {@link LightningGateway} backed by the LND REST API.
 *
 * <ul>
 *   <li>{@code POST /v1/invoices} creates invoices (amount in {@code value_msat})</li>
 *   <li>{@code GET /v1/invoice/{r_hash}} reports settlement</li>
 *   <li>{@code POST /v2/router/send} pays invoices and streams the final status</li>
 *   <li>{@code GET /v1/payreq/{pay_req}} decodes invoices we are asked to pay</li>
 * </ul>
 *
 * <p>Authentication is the hex-encoded admin macaroon in {@code Grpc-Metadata-macaroon}.
 * The node's self-signed TLS certificate can be pinned.</p>
 */
public class LndGateway implements LightningGateway {

    private static final System.Logger log = System.getLogger(LndGateway.class.getName());

    /** Maximum routing fee we are willing to pay per payment (satoshis). */
    private static final int MAX_FEE_SATS = 100;

    /** How long LND keeps trying to route a payment (seconds). */
    private static final int PAYMENT_TIMEOUT_SECONDS = 60;

    /** Lifetime of invoices we issue (seconds); matches the confirmation window. */
    private static final long INVOICE_EXPIRY_SECONDS = 3600;

    /** BOLT11 strings are bech32: letters and digits only. */
    private static final Pattern BOLT11_CHARS = Pattern.compile("^ln[a-zA-Z0-9]+$");

    private final String baseUrl;
    private final String macaroon;
    private final HttpClient httpClient;
    private final Duration pollInterval;
    private final ObjectMapper objectMapper = configuredObjectMapper();

    /**
     * @param host         LND host
     * @param restPort     LND REST port
     * @param macaroon     hex-encoded admin macaroon
     * @param httpClient   the HTTP client to use
     * @param pollInterval interval between settlement checks
     */
    public LndGateway(String host, int restPort, String macaroon, HttpClient httpClient, Duration pollInterval) {
        this.baseUrl = "https://" + host + ":" + restPort;
        this.macaroon = macaroon;
        this.httpClient = httpClient;
        this.pollInterval = pollInterval;
        log.log(System.Logger.Level.INFO, "LndGateway initialized for {0}:{1}", host, String.valueOf(restPort));
    }

    /**
     * Reads the macaroon file, optionally pins the TLS certificate, and builds a gateway.
     *
     * @param host         LND host
     * @param restPort     LND REST port
     * @param macaroonPath path to the admin macaroon file (required)
     * @param tlsCertPath  path to the node TLS certificate (empty = system trust store)
     * @param pollInterval interval between settlement checks
     * @return a configured gateway
     * @throws IllegalStateException if the macaroon or certificate cannot be loaded
     */
    public static LndGateway withMacaroonFile(String host, int restPort, String macaroonPath,
                                              String tlsCertPath, Duration pollInterval) {
        if (macaroonPath == null || macaroonPath.isBlank()) {
            throw new IllegalStateException("LND macaroon path must be configured");
        }
        String macaroonValue = readMacaroonAsHex(macaroonPath);

        HttpClient.Builder builder = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10));
        if (tlsCertPath != null && !tlsCertPath.isBlank()) {
            builder.sslContext(loadTlsCert(tlsCertPath));
            log.log(System.Logger.Level.INFO, "LndGateway configured with TLS cert from {0}", tlsCertPath);
        }
        return new LndGateway(host, restPort, macaroonValue, builder.build(), pollInterval);
    }

    private static ObjectMapper configuredObjectMapper() {
        ObjectMapper om = new ObjectMapper();
        om.deactivateDefaultTyping();
        return om;
    }

    @Override
    public Duration pollInterval() {
        return pollInterval;
    }

    @Override
    public GatewayInvoice createInvoice(long amountMsats, String description) {
        try {
            String json = objectMapper.writeValueAsString(Map.of(
                    "value_msat", String.valueOf(amountMsats),
                    "memo", description,
                    "expiry", String.valueOf(INVOICE_EXPIRY_SECONDS)
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/invoices"))
                    .header("Grpc-Metadata-macaroon", macaroon)
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(30))
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new LnurlException("LND invoice creation returned HTTP " + response.statusCode()
                        + ": " + response.body());
            }
            CreateInvoiceResponse raw = objectMapper.readValue(response.body(), CreateInvoiceResponse.class);
            if (raw == null || raw.rHash() == null || raw.paymentRequest() == null) {
                throw new LnurlException("Incomplete LND invoice response");
            }

            // LND returns r_hash as standard base64; lookups take hex
            String rHashHex = HexFormat.of().formatHex(Base64.getDecoder().decode(raw.rHash()));
            log.log(System.Logger.Level.INFO, "Created invoice: {0} msats, hash: {1}",
                    String.valueOf(amountMsats), rHashHex);
            return new GatewayInvoice(rHashHex, raw.paymentRequest());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LnurlException("LND request interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new LnurlException("LND invoice creation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isInvoicePaid(String paymentHash) {
        validatePaymentHash(paymentHash);
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/invoice/" + paymentHash))
                    .header("Grpc-Metadata-macaroon", macaroon)
                    .timeout(Duration.ofSeconds(15))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new LnurlException("LND invoice lookup returned HTTP " + response.statusCode());
            }
            Invoice invoice = objectMapper.readValue(response.body(), Invoice.class);
            return invoice != null && "SETTLED".equals(invoice.state());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LnurlException("LND request interrupted", e);
        } catch (IOException e) {
            throw new LnurlException("LND invoice lookup failed: " + e.getMessage(), e);
        }
    }

    /**
     * Decode via {@code /v1/payreq}. LND reports {@code num_msat} as a string; zero means
     * the invoice carries no amount.
     */
    @Override
    public OptionalLong decodeAmountMsats(String bolt11) {
        if (bolt11 == null || !BOLT11_CHARS.matcher(bolt11).matches()) {
            throw new IllegalArgumentException("Not a BOLT11 invoice: " + bolt11);
        }
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/payreq/" + bolt11))
                    .header("Grpc-Metadata-macaroon", macaroon)
                    .timeout(Duration.ofSeconds(15))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 400 || response.statusCode() == 500) {
                // LND answers unparseable invoices with an error status
                throw new IllegalArgumentException("LND could not decode invoice: " + response.body());
            }
            if (response.statusCode() != 200) {
                throw new LnurlException("LND invoice decode returned HTTP " + response.statusCode());
            }
            PayReq payReq = objectMapper.readValue(response.body(), PayReq.class);
            if (payReq == null || payReq.numMsat() == null) {
                throw new LnurlException("Incomplete LND decode response");
            }
            long amountMsats = Long.parseLong(payReq.numMsat());
            return amountMsats == 0 ? OptionalLong.empty() : OptionalLong.of(amountMsats);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LnurlException("LND request interrupted", e);
        } catch (NumberFormatException e) {
            throw new LnurlException("LND invoice decode returned a bad amount: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new LnurlException("LND invoice decode failed: " + e.getMessage(), e);
        }
    }

    /**
     * Pay via SendPaymentV2. LND gives up routing after {@value #PAYMENT_TIMEOUT_SECONDS}s;
     * the HTTP timeout is longer so a normal failure is reported before we stop listening.
     * The body is NDJSON; the last line carries the final status.
     */
    @Override
    public PaymentResult payInvoice(String bolt11) {
        HttpResponse<String> response;
        try {
            String json = objectMapper.writeValueAsString(Map.of(
                    "payment_request", bolt11,
                    "timeout_seconds", PAYMENT_TIMEOUT_SECONDS,
                    "fee_limit_sat", MAX_FEE_SATS,
                    "no_inflight_updates", true
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v2/router/send"))
                    .header("Grpc-Metadata-macaroon", macaroon)
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(PAYMENT_TIMEOUT_SECONDS + 30))
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();

            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PaymentResult.ambiguous("payment interrupted before LND answered");
        } catch (HttpTimeoutException e) {
            return PaymentResult.ambiguous("timed out waiting for LND: " + e.getMessage());
        } catch (ConnectException e) {
            return PaymentResult.failed("LND unreachable: " + e.getMessage());
        } catch (IOException e) {
            return PaymentResult.ambiguous("transport error during payment: " + e.getMessage());
        }

        if (response.statusCode() != 200) {
            return PaymentResult.failed("LND returned HTTP " + response.statusCode() + ": " + response.body());
        }

        PaymentResult result = parsePaymentResult(response.body());
        log.log(System.Logger.Level.INFO, "Paid invoice: hash={0}, outcome={1}",
                result.paymentHash(), result.outcome());
        return result;
    }

    private PaymentResult parsePaymentResult(String ndjsonBody) {
        String lastLine = Arrays.stream(ndjsonBody == null ? new String[0] : ndjsonBody.split("\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .reduce((first, second) -> second)
                .orElse(null);
        if (lastLine == null) {
            return PaymentResult.ambiguous("empty response from /v2/router/send");
        }

        JsonNode result;
        try {
            JsonNode root = objectMapper.readTree(lastLine);
            if (root.has("error")) {
                String message = root.path("error").path("message").asText(root.path("error").asText("unknown"));
                return PaymentResult.failed("LND rejected payment: " + message);
            }
            result = root.path("result");
        } catch (IOException e) {
            return PaymentResult.ambiguous("unparseable payment response: " + e.getMessage());
        }

        String status = result.path("status").asText("UNKNOWN");
        String paymentHash = result.path("payment_hash").asText(null);
        switch (status) {
            case "SUCCEEDED":
                return PaymentResult.succeeded(paymentHash);
            case "FAILED":
                return PaymentResult.failed("payment failed: " + result.path("failure_reason").asText("unknown"));
            default:
                return PaymentResult.ambiguous("payment status " + status);
        }
    }

    /**
     * Payment hashes are 64 hex characters. Prevents path injection into REST URIs.
     */
    private static void validatePaymentHash(String paymentHash) {
        if (paymentHash == null || paymentHash.length() != 64) {
            throw new IllegalArgumentException(
                    "paymentHash must be exactly 64 hex characters, got: " + paymentHash);
        }
        try {
            HexFormat.of().parseHex(paymentHash);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("paymentHash must be valid hex: " + paymentHash, e);
        }
    }

    private static String readMacaroonAsHex(String path) {
        try {
            return HexFormat.of().formatHex(Files.readAllBytes(Paths.get(path)));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read LND macaroon from: " + path, e);
        }
    }

    private static SSLContext loadTlsCert(String tlsCertPath) {
        try {
            Path certPath = Paths.get(tlsCertPath);
            if (!Files.exists(certPath)) {
                throw new IllegalStateException("LND TLS cert not found at: " + tlsCertPath);
            }
            byte[] certBytes = Files.readAllBytes(certPath);
            CertificateFactory cf = CertificateFactory.getInstance("X.509");
            X509Certificate cert = (X509Certificate) cf.generateCertificate(new ByteArrayInputStream(certBytes));

            KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
            keyStore.load(null, null);
            keyStore.setCertificateEntry("lnd", cert);

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(keyStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), null);
            return sslContext;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Could not load LND TLS cert from: " + tlsCertPath, e);
        }
    }

    /**
     * Response from LND invoice creation (/v1/invoices).
     *
     * @param rHash          payment hash (standard base64)
     * @param paymentRequest BOLT11-encoded invoice string
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CreateInvoiceResponse(
            @JsonProperty("r_hash") String rHash,
            @JsonProperty("payment_request") String paymentRequest
    ) {}

    /**
     * LND invoice details (/v1/invoice/{hash}).
     *
     * @param state invoice state ({@code OPEN}, {@code SETTLED}, {@code CANCELED}, {@code ACCEPTED})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Invoice(String state) {}

    /**
     * Decoded invoice (/v1/payreq/{pay_req}).
     *
     * @param numMsat amount in millisatoshis, {@code "0"} when amountless
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PayReq(@JsonProperty("num_msat") String numMsat) {}
}
