package com.claimrules.infrastructure.ai;

import com.claimrules.domain.extraction.exception.InvalidPipelineConfigException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience policies for reasoning calls.
 * <ul>
 *   <li>Retry: bounded attempts with exponential backoff, only {@link ReasoningCallException}.</li>
 *   <li>Time limit: per-batch deadline covering all attempts, measured from the start of the call.
 *       A call past its deadline is cancelled.</li>
 * </ul>
 */
@Slf4j
@Configuration
public class ReasoningResilienceConfig {

    @Value("${reasoning.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${reasoning.retry.initial-backoff-ms:500}")
    private long initialBackoffMs;

    @Value("${reasoning.retry.backoff-multiplier:2.0}")
    private double backoffMultiplier;

    @Value("${orchestrator.batch-timeout-seconds:180}")
    private long batchTimeoutSeconds;

    @Bean
    public Retry reasoningRetry() {
        return buildRetry(maxAttempts, Duration.ofMillis(initialBackoffMs), backoffMultiplier);
    }

    public static Retry buildRetry(int maxAttempts, Duration initialBackoff, double multiplier) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryExceptions(ReasoningCallException.class)
                .build();

        Retry retry = Retry.of("reasoning", config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("[Reasoning] Retry #{} in {}ms after: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    @Bean
    public TimeLimiter reasoningTimeLimiter() {
        return buildTimeLimiter(Duration.ofSeconds(batchTimeoutSeconds));
    }

    public static TimeLimiter buildTimeLimiter(Duration batchTimeout) {
        if (batchTimeout.isZero() || batchTimeout.isNegative()) {
            throw new InvalidPipelineConfigException(
                    "orchestrator.batch-timeout-seconds must be positive, got " + batchTimeout.toSeconds());
        }
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(batchTimeout)
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("reasoning", config);
    }
}
