package online.askahuman.tipme.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the Lightning collaborators.
 *
 * <p>Bind to {@code tipme.gateway.*} and {@code tipme.lightning-address.*} in application.yml.</p>
 */
@ConfigurationProperties(prefix = "tipme")
public class TipmeProperties {

    private Gateway gateway = new Gateway();
    private LightningAddress lightningAddress = new LightningAddress();

    public Gateway getGateway() { return gateway; }
    public void setGateway(Gateway gateway) { this.gateway = gateway; }

    public LightningAddress getLightningAddress() { return lightningAddress; }
    public void setLightningAddress(LightningAddress lightningAddress) { this.lightningAddress = lightningAddress; }

    /**
     * Payment gateway settings.
     */
    public static class Gateway {
        /** Backend type: {@code lnd} or {@code blitzi}. */
        private String type = "lnd";

        /** Interval between settlement checks while waiting for a payment. */
        private Duration pollInterval = Duration.ofSeconds(2);

        private Lnd lnd = new Lnd();
        private Blitzi blitzi = new Blitzi();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public Lnd getLnd() { return lnd; }
        public void setLnd(Lnd lnd) { this.lnd = lnd; }

        public Blitzi getBlitzi() { return blitzi; }
        public void setBlitzi(Blitzi blitzi) { this.blitzi = blitzi; }
    }

    /**
     * LND REST connection settings.
     */
    public static class Lnd {
        private String host = "localhost";

        /**
         * LND REST API port. Default 8181 avoids conflict with the server's own port (8080).
         */
        private int restPort = 8181;

        /** Path to the LND admin macaroon file. Required. */
        private String macaroonPath = "";

        /** Path to the LND TLS certificate file. Empty uses the system trust store. */
        private String tlsCertPath = "";

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getRestPort() { return restPort; }
        public void setRestPort(int restPort) { this.restPort = restPort; }

        public String getMacaroonPath() { return macaroonPath; }
        public void setMacaroonPath(String macaroonPath) { this.macaroonPath = macaroonPath; }

        public String getTlsCertPath() { return tlsCertPath; }
        public void setTlsCertPath(String tlsCertPath) { this.tlsCertPath = tlsCertPath; }
    }

    /**
     * Blitzi payment server settings.
     */
    public static class Blitzi {
        private String url = "http://localhost:3000";

        /** Bearer token, empty for none. */
        private String token = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
    }

    /**
     * Lightning-address (LUD-16) resolution settings.
     */
    public static class LightningAddress {
        private Duration requestTimeout = Duration.ofSeconds(15);

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }
}
