package com.hydra.runtime.module;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * One lifecycle capability of a module (Init, Start or Stop).
 *
 * <p>The returned stage may settle later; the lifecycle chain waits for it. Throwing and
 * completing the stage exceptionally are both treated as a failed attempt.</p>
 */
@FunctionalInterface
public interface LifecycleHandler {

    CompletionStage<?> run() throws Exception;

    /**
     * Adapt a synchronous action.
     */
    static LifecycleHandler sync(Action action) {
        return () -> {
            action.run();
            return CompletableFuture.completedFuture(null);
        };
    }

    /**
     * A synchronous lifecycle action.
     */
    @FunctionalInterface
    interface Action {
        void run() throws Exception;
    }
}
