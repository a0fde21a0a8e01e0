package com.eainde.forecast.graph.nodes;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ForecastException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits for a fan-out to finish within the run's remaining budget.
 */
final class Barrier {

    private Barrier() {
    }

    /**
     * @return results in the order of {@code futures}
     * @throws ForecastException {@code TIMEOUT_EXCEEDED} when the budget runs out first
     */
    static <T> List<T> await(RunContext ctx, List<CompletableFuture<T>> futures) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(ctx.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            futures.forEach(f -> f.cancel(true));
            throw ForecastException.timeout(ctx.state(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw ForecastException.timeout(ctx.state(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ForecastException fe) {
                throw fe;
            }
            // tasks handle their own failures; anything else reaching here is a bug
            throw new IllegalStateException("Parallel step failed", e.getCause());
        }
        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> f : futures) {
            results.add(f.join());
        }
        return results;
    }
}
