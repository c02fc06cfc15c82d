package com.example.workflowhub.api.v1;

import com.example.workflowhub.api.v1.dto.WebhookResponse;
import com.example.workflowhub.domain.WebhookOutcome;
import com.example.workflowhub.webhook.IngestResult;
import com.example.workflowhub.webhook.WebhookIngestionGateway;

import jakarta.servlet.http.HttpServletRequest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound webhooks: {@code POST /webhooks/{source}}.
 * <p>
 * The body is taken as raw bytes so the signature covers exactly what was sent. The caller is the socket
 * peer address; forwarding headers are ignored.
 * </p>
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final WebhookIngestionGateway gateway;

    @PostMapping("/webhooks/{source}")
    public ResponseEntity<WebhookResponse> receive(@PathVariable String source,
                                                   @RequestHeader HttpHeaders headers,
                                                   @RequestBody(required = false) byte[] body,
                                                   HttpServletRequest request) {
        IngestResult result = gateway.ingest(source, headers, body, request.getRemoteAddr());
        if (result.isAccepted()) {
            return ResponseEntity.ok(WebhookResponse.ok(result.result()));
        }
        return ResponseEntity.status(statusFor(result.outcome())).body(WebhookResponse.failed(result.message()));
    }

    static HttpStatus statusFor(WebhookOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> HttpStatus.OK;
            case UNKNOWN_SOURCE, AUTHENTICATION_FAILURE -> HttpStatus.UNAUTHORIZED;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case MALFORMED_PAYLOAD, UNSUPPORTED_EVENT -> HttpStatus.BAD_REQUEST;
            case ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
