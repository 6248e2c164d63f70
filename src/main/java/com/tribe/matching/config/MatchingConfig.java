package com.tribe.matching.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.tribe.matching.client.AdvisoryClient;
import com.tribe.matching.client.NoOpAdvisoryClient;
import com.tribe.matching.client.OpenRouterAdvisoryClient;
import com.tribe.matching.dto.FormationOptions;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;


@Configuration
@Slf4j
public class MatchingConfig {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean(name = "compatibilityExecutor", destroyMethod = "shutdown")
    public ExecutorService compatibilityExecutor(MeterRegistry meterRegistry,
                                                 @Value("${matching.executor.compatibility.threads:0}") int threads) {
        int cpus = Runtime.getRuntime().availableProcessors();
        int core = threads > 0 ? threads : Math.max(2, cpus);
        ThreadFactory threadFactory = new ThreadFactoryBuilder().setNameFormat("compat-score-%d").build();
        return new ThreadPoolExecutor(
                core, core * 2,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(10_000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("compatibility_executor_rejections").increment();
                        log.warn("compatibility task rejected: queue size={}", e.getQueue().size());
                        super.rejectedExecution(r, e);
                    }
                }
        );
    }

    @Bean(name = "advisoryExecutor", destroyMethod = "shutdown")
    public ExecutorService advisoryExecutor() {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("advisory-%d")
                .setDaemon(true)
                .build();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                2, 4, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(200),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Bean(name = "profileStoreExecutor", destroyMethod = "shutdown")
    public ExecutorService profileStoreExecutor(MeterRegistry meterRegistry,
                                                @Value("${matching.store.threads:4}") int threads) {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("profile-store-%d")
                .setDaemon(true)
                .build();
        return new ThreadPoolExecutor(
                threads, threads,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1_000),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("profile_store_executor_rejections").increment();
                        super.rejectedExecution(r, e);
                    }
                }
        );
    }

    @Bean
    public CircuitBreaker advisoryCircuitBreaker(AdvisoryProperties properties) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(properties.getFailureRateThreshold())
                .slidingWindowSize(properties.getSlidingWindowSize())
                .minimumNumberOfCalls(Math.min(5, properties.getSlidingWindowSize()))
                .waitDurationInOpenState(Duration.ofSeconds(properties.getOpenStateSeconds()))
                .build();
        return CircuitBreaker.of("advisory", config);
    }

    @Bean
    @ConditionalOnMissingBean
    public AdvisoryClient advisoryClient(AdvisoryProperties properties) {
        if (properties.isEnabled() && StringUtils.isNotBlank(properties.getApiKey())) {
            log.info("Advisory client enabled: baseUrl={}, model={}", properties.getBaseUrl(), properties.getModel());
            return new OpenRouterAdvisoryClient(RestClient.builder(), properties);
        }
        log.info("Advisory client disabled, algorithmic scores only");
        return new NoOpAdvisoryClient();
    }

    @Bean
    public FormationOptions defaultFormationOptions(
            @Value("${matching.min-group-size:4}") int minGroupSize,
            @Value("${matching.max-group-size:8}") int maxGroupSize,
            @Value("${matching.max-distance-miles:25}") double maxDistance,
            @Value("${matching.compatibility-threshold:0.70}") double threshold,
            @Value("${matching.prefer-existing-tribes:true}") boolean preferExistingTribes,
            @Value("${matching.max-batch-size:1000}") int maxBatchSize) {
        return FormationOptions.builder()
                .minGroupSize(minGroupSize)
                .maxGroupSize(maxGroupSize)
                .maxDistance(maxDistance)
                .compatibilityThreshold(threshold)
                .preferExistingTribes(preferExistingTribes)
                .maxBatchSize(maxBatchSize)
                .build()
                .sanitized();
    }
}
