package com.aiusage.attribution.config;

import com.aiusage.attribution.adapters.SourceNormalizer;
import com.aiusage.attribution.adapters.SourceNormalizerRegistry;
import com.aiusage.attribution.normalization.EmailNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for source normalizers, identity normalization, the clock and the per-source worker pool.
 */
@Configuration
@EnableConfigurationProperties(AttributionProperties.class)
public class PipelineConfig {

    @Bean
    public SourceNormalizerRegistry sourceNormalizerRegistry(List<SourceNormalizer> normalizers) {
        return new SourceNormalizerRegistry(normalizers);
    }

    @Bean
    public EmailNormalizer emailNormalizer(AttributionProperties properties) {
        return new EmailNormalizer(properties.getIdentity().getAliasDomains());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(@Value("${attribution.parallelism:4}") int parallelism) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, parallelism), runnable -> {
            Thread thread = new Thread(runnable, "attribution-source-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
