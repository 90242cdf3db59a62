package online.askahuman.tipme.server.config;

import online.askahuman.tipme.server.service.ConfirmationTaskRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ServerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Executor for confirmation waits. Shut down with the context; running waits are
     * interrupted and end as timed out.
     */
    @Bean(destroyMethod = "shutdown")
    public ConfirmationTaskRunner confirmationTaskRunner() {
        return ConfirmationTaskRunner.cachedDaemonPool();
    }
}
