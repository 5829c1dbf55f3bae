package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.model.ActiveProjectSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The process-wide record of which project is active and how its resources loaded.
 *
 * Readers always see a complete snapshot. Only {@link ProjectSwitchService}
 * publishes new ones.
 */
@Component
public class ActiveProjectState {

    private final AtomicReference<ActiveProjectSnapshot> current =
            new AtomicReference<>(ActiveProjectSnapshot.empty(List.of()));

    public ActiveProjectSnapshot snapshot() {
        return current.get();
    }

    void publish(ActiveProjectSnapshot snapshot) {
        current.set(snapshot);
    }
}
