package com.jiracdc.dispatch.api;

import com.jiracdc.core.scheduler.PollScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives Jira webhooks. The payload only serves as a hint: any event triggers an early poll,
 * which reconciles everything changed since the last successful sync.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final PollScheduler pollScheduler;

    public WebhookController(PollScheduler pollScheduler) {
        this.pollScheduler = pollScheduler;
    }

    @PostMapping("/jira")
    public ResponseEntity<Map<String, Object>> jiraWebhook(@RequestBody(required = false) Map<String, Object> payload) {
        Object event = payload != null ? payload.get("webhookEvent") : null;
        Object issueKey = payload != null && payload.get("issue") instanceof Map<?, ?> issue ? issue.get("key") : null;
        log.info("Received Jira webhook event={} issue={}", event, issueKey);

        boolean queued = pollScheduler.requestEarlyPoll();
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "poll_queued", queued));
    }
}
