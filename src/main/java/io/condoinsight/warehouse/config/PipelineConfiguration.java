package io.condoinsight.warehouse.config;

import io.condoinsight.warehouse.rules.RuleRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfiguration {

    /**
     * One registry per process; its version is fixed at construction and
     * copied onto every batch it derives.
     */
    @Bean
    public RuleRegistry ruleRegistry() {
        return RuleRegistry.standard();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
