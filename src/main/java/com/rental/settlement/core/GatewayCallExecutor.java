package com.rental.settlement.core;

import com.rental.settlement.api.GatewayUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs gateway calls under a Resilience4j time limiter and circuit breaker, both named after
 * the gateway. Calls are not retried: a failed order-create surfaces straight to the waiting
 * client, and a timed-out call leaves no ledger state behind, so the client may simply retry.
 */
@Slf4j
@Component
public class GatewayCallExecutor {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final Executor gatewayExecutor;

    public GatewayCallExecutor(CircuitBreakerRegistry circuitBreakerRegistry,
                               TimeLimiterRegistry timeLimiterRegistry,
                               @Qualifier("gatewayExecutor") Executor gatewayExecutor) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.gatewayExecutor = gatewayExecutor;
    }

    /**
     * @param gatewayName circuit breaker and time limiter instance name
     * @param operation   short label for logs (createOrder, refund)
     * @throws GatewayUnavailableException on timeout, open circuit, rejection or adapter failure
     */
    public <T> T execute(String gatewayName, String operation, Supplier<T> call) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(gatewayName);
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(gatewayName);

        Supplier<CompletableFuture<T>> futureSupplier = () -> CompletableFuture.supplyAsync(call, gatewayExecutor);
        Callable<T> limited = TimeLimiter.decorateFutureSupplier(timeLimiter, futureSupplier);
        Callable<T> guarded = CircuitBreaker.decorateCallable(circuitBreaker, limited);

        try {
            return guarded.call();
        } catch (CallNotPermittedException e) {
            log.warn("Gateway circuit open: gateway={} operation={}", gatewayName, operation);
            throw new GatewayUnavailableException("Payment gateway is temporarily unavailable. Retry later.", e);
        } catch (TimeoutException e) {
            log.warn("Gateway call timed out: gateway={} operation={} limit={}",
                    gatewayName, operation, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new GatewayUnavailableException("Payment gateway did not respond in time. Retry later.", e);
        } catch (TaskRejectedException e) {
            log.warn("Gateway executor saturated: gateway={} operation={}", gatewayName, operation);
            throw new GatewayUnavailableException("Payment gateway is busy. Retry later.", e);
        } catch (GatewayException e) {
            log.warn("Gateway rejected call: gateway={} operation={} error={}", gatewayName, operation, e.getMessage());
            throw new GatewayUnavailableException("Payment gateway rejected the request: " + e.getMessage(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Gateway call failed: gateway={} operation={} error={}", gatewayName, operation, cause.getMessage());
            throw new GatewayUnavailableException("Payment gateway call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayUnavailableException("Interrupted while waiting for the payment gateway", e);
        } catch (Exception e) {
            log.error("Unexpected gateway failure: gateway={} operation={}", gatewayName, operation, e);
            throw new GatewayUnavailableException("Payment gateway call failed", e);
        }
    }
}
