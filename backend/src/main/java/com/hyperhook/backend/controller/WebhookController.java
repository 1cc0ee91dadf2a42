package com.hyperhook.backend.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperhook.backend.config.WebhookProperties;
import com.hyperhook.backend.dto.ResponseEnvelope;
import com.hyperhook.backend.dto.TradeSignal;
import com.hyperhook.backend.model.ErrorType;
import com.hyperhook.backend.security.WebhookAuthenticator;
import com.hyperhook.backend.service.SignalDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Webhook")
public class WebhookController {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final ObjectMapper objectMapper;
    private final WebhookAuthenticator webhookAuthenticator;
    private final SignalDispatcher signalDispatcher;
    private final WebhookProperties webhookProperties;

    @PostMapping(value = {"/webhook", "/"}, produces = "application/json")
    @Operation(summary = "Execute a TradingView alert (long, short or close)")
    public ResponseEntity<ResponseEnvelope> receive(@RequestBody(required = false) String body,
                                                    HttpServletRequest request) {
        TradeSignal signal = parse(body);
        if (signal == null) {
            return ResponseEntity.badRequest()
                    .body(ResponseEnvelope.error(ErrorType.VALIDATION, "Invalid JSON in request body"));
        }

        String sourceAddress = resolveSourceAddress(request);
        if (!webhookAuthenticator.authenticate(signal, sourceAddress)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(ResponseEnvelope.error(ErrorType.AUTH, "Unauthorized"));
        }

        ResponseEnvelope response = signalDispatcher.dispatch(signal);
        HttpStatus status = response.isError() ? HttpStatus.BAD_REQUEST : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Returns {@code null} when the body is missing or is not a JSON object.
     */
    private TradeSignal parse(String body) {
        if (body == null || body.isBlank()) {
            log.error("Empty request body");
            return null;
        }
        try {
            return objectMapper.readValue(body, TradeSignal.class);
        } catch (JsonProcessingException e) {
            log.error("Invalid JSON in request body: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String resolveSourceAddress(HttpServletRequest request) {
        if (!webhookProperties.isEnforceSourceAddress()) {
            return null;
        }
        if (webhookProperties.isTrustForwardedFor()) {
            String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }
}
