package com.commodityforecast.service;

import com.commodityforecast.exception.NonConvergentFitException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Worker pool for CPU-bound stages that do not depend on each other. Callers submit both
 * stages and then {@link #await} each before starting the stage that needs them.
 */
@Slf4j
@Component
public class ModelFitExecutor {

    @Value("${analysis.executor.pool-size:4}")
    private int poolSize;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public <T> Future<T> submit(String stage, Supplier<T> task) {
        log.debug("Submitting stage {}", stage);
        return executor.submit(task::get);
    }

    /**
     * Start of a shared wait: stages awaited one after another against the same deadline
     * together never wait longer than {@code budget}.
     */
    public Deadline deadline(Duration budget) {
        return new Deadline(budget, System.nanoTime() + budget.toNanos());
    }

    /**
     * Waits for a submitted stage until the deadline. A stage still running then is cancelled and
     * its result discarded; a stage that failed rethrows its own exception.
     */
    public <T> T await(Future<T> future, String stage, Deadline deadline) {
        try {
            return future.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new NonConvergentFitException(stage,
                "Stage " + stage + " did not finish within " + deadline.budget(),
                Map.of("fitTimeout", deadline.budget().toString()), ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new NonConvergentFitException(stage, "Interrupted while waiting for stage " + stage,
                Map.of("fitTimeout", deadline.budget().toString()), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Stage " + stage + " failed", cause);
        }
    }

    public void cancel(Future<?>... futures) {
        for (Future<?> future : futures) {
            if (future != null) {
                future.cancel(true);
            }
        }
    }

    public record Deadline(Duration budget, long expiresAtNanos) {

        long remainingNanos() {
            return Math.max(0L, expiresAtNanos - System.nanoTime());
        }
    }
}
