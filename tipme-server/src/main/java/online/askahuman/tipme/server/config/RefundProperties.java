package online.askahuman.tipme.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Refund sweep settings. Bind to {@code tipme.refund.*}.
 */
@ConfigurationProperties(prefix = "tipme.refund")
public class RefundProperties {

    /** Whether the periodic sweep is scheduled at all. */
    private boolean enabled = true;

    /** Delay between sweeps; the first sweep runs at startup. */
    private Duration period = Duration.ofHours(24);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Duration getPeriod() { return period; }
    public void setPeriod(Duration period) { this.period = period; }
}
