package com.example.workflowhub.api.v1;

import com.example.workflowhub.api.v1.dto.WebhookLogListResponse;
import com.example.workflowhub.api.v1.dto.WebhookLogResponse;
import com.example.workflowhub.security.Actor;
import com.example.workflowhub.security.ActorAuthenticationFilter;
import com.example.workflowhub.security.Roles;
import com.example.workflowhub.webhook.WebhookLogService;

import lombok.RequiredArgsConstructor;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
public class WebhookLogController {

    private final WebhookLogService logService;

    @GetMapping("/logs")
    public ResponseEntity<WebhookLogListResponse> logs(@RequestAttribute(ActorAuthenticationFilter.ACTOR_ATTRIBUTE) Actor actor,
                                                       @RequestParam(required = false) String source) {
        Roles.requireAdmin(actor);
        List<WebhookLogResponse> logs = logService.findRecent(source).stream()
                .map(record -> new WebhookLogResponse(
                        record.getId(),
                        record.getSource(),
                        record.getEventType(),
                        record.getCaller(),
                        record.getOutcome().name(),
                        record.getPayloadDigest(),
                        record.getPayloadSize(),
                        record.getErrorMessage(),
                        record.getReceivedAt()))
                .toList();
        return ResponseEntity.ok(new WebhookLogListResponse(logs));
    }
}
