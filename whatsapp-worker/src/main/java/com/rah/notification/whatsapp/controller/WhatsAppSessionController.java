package com.rah.notification.whatsapp.controller;

import com.rah.notification.whatsapp.model.SessionStatus;
import com.rah.notification.whatsapp.session.WhatsAppSessionManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator view of the worker's WhatsApp session.
 *
 * After a logout the session stays down until someone calls re-link and scans the
 * pairing code returned by the status endpoint.
 */
@RestController
@RequestMapping("/api/whatsapp/session")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "WhatsApp session", description = "Status and re-link of the linked WhatsApp device")
public class WhatsAppSessionController {

    private final WhatsAppSessionManager sessionManager;

    @GetMapping
    @Operation(summary = "Current session state, last disconnect reason and pending pairing code")
    public ResponseEntity<SessionStatus> getStatus() {
        return ResponseEntity.ok(sessionManager.getStatus());
    }

    @PostMapping("/relink")
    @Operation(summary = "Drop stored credentials and start pairing a new device")
    public ResponseEntity<SessionStatus> relink() {
        try {
            SessionStatus status = sessionManager.relink();
            log.info("WhatsApp re-link requested, session state: {}", status.state());
            return ResponseEntity.accepted().body(status);
        } catch (IllegalStateException e) {
            log.warn("WhatsApp re-link rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(sessionManager.getStatus());
        }
    }
}
