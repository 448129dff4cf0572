package com.phillippitts.callscribe.service.session;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic safety net for missed membership events: asks the coordinator to re-evaluate.
 */
@Component
class SessionTicker {

    private final SessionCoordinator coordinator;

    SessionTicker(SessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(initialDelayString = "${session.tick-interval-ms:5000}", fixedDelayString = "${session.tick-interval-ms:5000}")
    void tick() {
        coordinator.requestTick();
    }
}
