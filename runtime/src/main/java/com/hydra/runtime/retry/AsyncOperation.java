package com.hydra.runtime.retry;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A single attempt of a retryable operation.
 *
 * <p>Thrown exceptions, errors other than {@link VirtualMachineError}, and exceptionally
 * completed stages all count as a failed attempt.</p>
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    CompletionStage<T> call() throws Exception;

    /**
     * Run one attempt, capturing a thrown exception or a {@code null} stage in the result.
     *
     * @return a future completed with the attempt's value or failure
     */
    default CompletableFuture<T> attempt() {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            CompletionStage<T> stage = call();
            if (stage == null) {
                result.complete(null);
            } else {
                stage.whenComplete((value, error) -> {
                    if (error != null) {
                        result.completeExceptionally(RetryEngine.unwrap(error));
                    } else {
                        result.complete(value);
                    }
                });
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Adapt a synchronous operation.
     */
    static <T> AsyncOperation<T> of(Callable<T> callable) {
        return () -> CompletableFuture.completedFuture(callable.call());
    }
}
