package com.strollie.planner.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Timeout and retry for one outbound call. The call must be lazy so that every attempt re-executes it.
 */
@Slf4j
public final class RetryingCall {

    private RetryingCall() {
    }

    public static <T> Mono<T> withRetry(Mono<T> call, RetryPolicy policy, Duration timeout) {
        return withRetry("call", call, policy, timeout);
    }

    public static <T> Mono<T> withRetry(String name, Mono<T> call, RetryPolicy policy, Duration timeout) {
        Mono<T> attempt = Mono.defer(() -> call).timeout(timeout);
        if (policy.retries() == 0) {
            return attempt;
        }
        return attempt.retryWhen(Retry.backoff(policy.retries(), policy.initialBackoff())
                .maxBackoff(policy.maxBackoff())
                .filter(RetryingCall::isRetryable)
                .doBeforeRetry(signal -> log.warn("Retrying {} (attempt {}): {}",
                        name, signal.totalRetries() + 2, signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    /**
     * Client errors other than 429 are not retried; the same request would fail again.
     */
    static boolean isRetryable(Throwable error) {
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return true;
    }
}
