package com.incidentcommander.notification.controller;

import com.incidentcommander.common.model.EscalationRecord;
import com.incidentcommander.notification.sender.SlackWebhookSender;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/notify")
public class NotificationController {

    private final SlackWebhookSender slackSender;

    public NotificationController(SlackWebhookSender slackSender) {
        this.slackSender = slackSender;
    }

    @PostMapping("/escalation")
    public ResponseEntity<Void> notifyEscalation(@RequestBody EscalationRecord record) {
        if (record.incident() == null || record.reason() == null) {
            return ResponseEntity.badRequest().build();
        }
        slackSender.sendEscalation(record);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
