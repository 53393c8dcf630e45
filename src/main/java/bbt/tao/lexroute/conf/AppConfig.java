package bbt.tao.lexroute.conf;

import bbt.tao.lexroute.resilience.CircuitRegistry;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(LexRouteProperties.class)
public class AppConfig {

    @Bean
    public Clock systemClock() {
        return Clock.system(ZoneId.systemDefault());
    }

    @Bean
    public CircuitRegistry circuitRegistry(Clock clock) {
        return new CircuitRegistry(clock);
    }

    @Bean
    public ResilienceMiddleware resilienceMiddleware(CircuitRegistry circuitRegistry) {
        return new ResilienceMiddleware(circuitRegistry);
    }

    @Bean
    public ResiliencePolicies resiliencePolicies(LexRouteProperties properties) {
        return new ResiliencePolicies(properties.getResilience());
    }
}
