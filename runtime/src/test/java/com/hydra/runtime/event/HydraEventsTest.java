package com.hydra.runtime.event;

import com.hydra.config.LifecyclePhase;
import com.hydra.config.Location;
import com.hydra.runtime.module.ModuleInstance;
import com.hydra.runtime.retry.RetryEventListener;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HydraEventsTest {

    @Test
    void errorCarriesSourceAndSide() {
        HydraEvents events = new HydraEvents(Location.CLIENT);
        List<String> received = new ArrayList<>();
        events.addErrorListener((source, message, side) -> received.add(source + "|" + message + "|" + side));

        events.reportError("Ui.Hud", "texture missing");

        assertEquals(List.of("Ui.Hud|texture missing|CLIENT"), received);
    }

    @Test
    void throwingListenerDoesNotBlockOthers() {
        HydraEvents events = new HydraEvents(Location.SERVER);
        List<String> received = new ArrayList<>();
        events.addErrorListener((source, message, side) -> {
            throw new IllegalStateException("listener broke");
        });
        events.addErrorListener((source, message, side) -> received.add(message));
        events.addModuleLoadedListener((name, instance) -> {
            throw new IllegalStateException("listener broke");
        });
        events.addModuleLoadedListener((name, instance) -> received.add("loaded " + name));

        events.reportError("Hydra", "boom");
        events.moduleLoaded("Core.Log", ModuleInstance.of("Core.Log", "log"));

        assertEquals(List.of("boom", "loaded Core.Log"), received);
    }

    @Test
    void retryEventsReachEveryListener() {
        HydraEvents events = new HydraEvents(Location.SERVER);
        List<String> received = new ArrayList<>();
        events.addRetryListener(new RetryEventListener() {
            @Override
            public void onExhausted(String moduleName, LifecyclePhase phase, int attempts, String message) {
                throw new IllegalStateException("listener broke");
            }
        });
        events.addRetryListener(new RetryEventListener() {
            @Override
            public void onExhausted(String moduleName, LifecyclePhase phase, int attempts, String message) {
                received.add(moduleName + " " + phase + " " + attempts + " " + message);
            }
        });

        events.onExhausted("Core.Db", LifecyclePhase.START, 3, "boom");
        events.onEscalated("Core.Db", LifecyclePhase.START);

        assertEquals(List.of("Core.Db Start 3 boom"), received);
    }

    @Test
    void removedAndClearedListenersAreNotCalled() {
        HydraEvents events = new HydraEvents(Location.SERVER);
        List<String> received = new ArrayList<>();
        HydraErrorListener listener = (source, message, side) -> received.add(message);
        events.addErrorListener(listener);
        events.removeErrorListener(listener);
        events.reportError("Hydra", "first");

        events.addErrorListener(listener);
        events.clear();
        events.reportError("Hydra", "second");

        assertTrue(received.isEmpty());
    }
}
