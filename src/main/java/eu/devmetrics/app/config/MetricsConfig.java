package eu.devmetrics.app.config;

import eu.devmetrics.app.git.ProductionTagMatcher;
import eu.devmetrics.app.git.ProductionTagPatterns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans shared by the metric services.
 */
@Configuration
@Slf4j
public class MetricsConfig {

    @Bean
    public ProductionTagMatcher productionTagMatcher() {
        log.info("Production tag matcher configured with {} patterns", ProductionTagPatterns.DEFAULTS.size());
        return new ProductionTagMatcher(ProductionTagPatterns.DEFAULTS);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
