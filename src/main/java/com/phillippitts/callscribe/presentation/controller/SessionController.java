package com.phillippitts.callscribe.presentation.controller;

import com.phillippitts.callscribe.service.session.SessionCoordinator;
import com.phillippitts.callscribe.service.session.SessionStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator commands for the voice session.
 */
@RestController
@RequestMapping("/api/session")
public class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final SessionCoordinator coordinator;

    public SessionController(SessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping
    public SessionStatus status() {
        return coordinator.status();
    }

    @PostMapping("/join/{channelId}")
    public ResponseEntity<SessionStatus> join(@PathVariable String channelId) {
        LOG.info("Manual join requested: channel={}", channelId);
        return ResponseEntity.accepted().body(coordinator.joinManually(channelId));
    }

    @PostMapping("/leave")
    public ResponseEntity<SessionStatus> leave() {
        LOG.info("Manual leave requested");
        return ResponseEntity.accepted().body(coordinator.leaveManually());
    }

    @PostMapping("/auto")
    public SessionStatus resumeAuto() {
        return coordinator.resumeAuto();
    }
}
