package online.askahuman.tipme.server.config;

import online.askahuman.tipme.server.service.RefundJob;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Schedules the refund sweep on a dedicated single-thread scheduler: once at startup, then
 * every {@code tipme.refund.period}. Does not use {@code @EnableScheduling}.
 */
@Configuration
@ConditionalOnProperty(prefix = "tipme.refund", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RefundJobConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService refundJobScheduler(RefundJob refundJob, RefundProperties props) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tipme-refund-job");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(refundJob, 0, props.getPeriod().toMillis(), TimeUnit.MILLISECONDS);
        return scheduler;
    }
}
