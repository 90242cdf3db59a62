package online.askahuman.tipme.spring;

import online.askahuman.tipme.lnurl.LightningAddressResolver;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for {@link LightningAddressResolver}.
 */
@AutoConfiguration
@EnableConfigurationProperties(TipmeProperties.class)
public class LightningAddressAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LightningAddressResolver lightningAddressResolver(TipmeProperties props) {
        return LightningAddressResolver.create(props.getLightningAddress().getRequestTimeout());
    }
}
