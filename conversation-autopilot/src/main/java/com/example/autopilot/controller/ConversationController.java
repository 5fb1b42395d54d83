package com.example.autopilot.controller;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.ConversationSnapshot;
import com.example.autopilot.domain.Message;
import com.example.autopilot.dto.InboundMessagePayload;
import com.example.autopilot.dto.IngestResponse;
import com.example.autopilot.service.ConversationOrchestrator;
import com.example.autopilot.service.IngestResult;
import com.example.autopilot.service.exception.ServiceException;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationOrchestrator orchestrator;
    private final AutopilotProperties properties;

    public ConversationController(ConversationOrchestrator orchestrator, AutopilotProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @PostMapping("/{conversationId}/messages")
    public ResponseEntity<IngestResponse> ingest(
            @PathVariable String conversationId,
            @Valid @RequestBody InboundMessagePayload payload) {
        payload.setConversationId(conversationId);
        IngestResult result = orchestrator.ingest(payload.toInboundMessage());
        HttpStatus status = result == IngestResult.DUPLICATE ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(IngestResponse.builder()
                .conversationId(conversationId)
                .result(result)
                .build());
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<ConversationSnapshot> getConversation(@PathVariable String conversationId) {
        return ResponseEntity.ok(orchestrator.snapshot(conversationId)
                .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Conversation not found", "conversation_not_found")));
    }

    @GetMapping("/{conversationId}/messages")
    public ResponseEntity<List<Message>> getMessages(
            @PathVariable String conversationId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        int resolved = limit != null && limit > 0 ? limit : properties.getHistory().getPageLimit();
        return ResponseEntity.ok(orchestrator.history(conversationId, resolved));
    }

    @PostMapping("/{conversationId}/archive")
    public ResponseEntity<ConversationSnapshot> archive(@PathVariable String conversationId) {
        return ResponseEntity.ok(orchestrator.teardown(conversationId));
    }

    @DeleteMapping("/{conversationId}/memory")
    public ResponseEntity<Void> resetMemory(@PathVariable String conversationId) {
        orchestrator.resetMemory(conversationId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{conversationId}/quarantine/release")
    public ResponseEntity<ConversationSnapshot> releaseQuarantine(@PathVariable String conversationId) {
        return ResponseEntity.ok(orchestrator.releaseQuarantine(conversationId));
    }
}
