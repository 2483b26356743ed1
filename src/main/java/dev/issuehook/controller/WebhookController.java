package dev.issuehook.controller;

import dev.issuehook.dto.response.EventOutcome;
import dev.issuehook.infrastructure.github.WebhookSignatureVerifier;
import dev.issuehook.service.IssueEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * GitHub webhook receiver. Validates the HMAC signature, then hands
 * {@code issues} events to {@link IssueEventHandler} synchronously.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);
    private final WebhookSignatureVerifier signatureVerifier;
    private final IssueEventHandler eventHandler;

    public WebhookController(WebhookSignatureVerifier signatureVerifier, IssueEventHandler eventHandler) {
        this.signatureVerifier = signatureVerifier;
        this.eventHandler = eventHandler;
    }

    @PostMapping("/github")
    public ResponseEntity<?> handleWebhook(
            @RequestHeader("X-GitHub-Event") String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody String rawBody) {

        // Verify HMAC signature against raw bytes before any deserialization
        if (!signatureVerifier.isValid(rawBody.getBytes(StandardCharsets.UTF_8), signature)) {
            log.warn("Webhook signature verification failed for delivery={}", deliveryId);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", "rejected", "reason", "invalid signature"));
        }

        if ("ping".equals(eventType))
            return ResponseEntity.ok(EventOutcome.success("pong"));

        if (!"issues".equals(eventType))
            return ResponseEntity.ok(EventOutcome.skipped("Event type " + eventType + " is not handled"));

        MDC.put("deliveryId", deliveryId == null ? "-" : deliveryId);
        try {
            log.info("Webhook: event={}, delivery={}", eventType, deliveryId);
            EventOutcome outcome = eventHandler.handle(rawBody);
            HttpStatus status = outcome.status() == EventOutcome.Status.ERROR
                    ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.OK;
            return ResponseEntity.status(status).body(outcome);
        } finally {
            MDC.remove("deliveryId");
        }
    }
}
