package com.example.autopilot.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.ApprovalRequest;
import com.example.autopilot.domain.ApprovalStatus;
import com.example.autopilot.dto.ApprovalDecisionPayload;
import com.example.autopilot.dto.ApprovalResolutionResponse;
import com.example.autopilot.event.ConversationEvent;
import com.example.autopilot.event.ConversationEventListener;
import com.example.autopilot.service.ApprovalBroker;
import com.example.autopilot.service.ApprovalChannel;
import com.example.autopilot.service.ResolutionResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Live approval console over socket.io. Approvers join one room, receive every new request and
 * lifecycle event, and answer with {@code approval:resolve}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "autopilot.socketio.enabled", havingValue = "true", matchIfMissing = true)
public class SocketIoApprovalChannel implements ApprovalChannel, ConversationEventListener {

    static final String APPROVERS_ROOM = "approvers";
    static final String REQUEST_EVENT = "approval:request";
    static final String RESOLVE_EVENT = "approval:resolve";
    static final String RESULT_EVENT = "approval:result";
    static final String LIFECYCLE_EVENT = "conversation:event";
    static final String ERROR_EVENT = "system:error";

    private static final String PARAM_TOKEN = "token";

    private final SocketIOServer socketIOServer;
    private final ApprovalBroker approvalBroker;
    private final AutopilotProperties properties;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(client -> log.debug("Approver {} disconnected", client.getSessionId()));
        socketIOServer.addEventListener(RESOLVE_EVENT, ApprovalDecisionPayload.class, this::handleResolve);
    }

    void handleConnect(SocketIOClient client) {
        String expected = properties.getApproval().getConsoleToken();
        String presented = client.getHandshakeData().getSingleUrlParam(PARAM_TOKEN);
        if (StringUtils.hasText(expected) && !expected.equals(presented)) {
            log.warn("Rejected approval console connection {} with invalid token", client.getSessionId());
            client.sendEvent(ERROR_EVENT, Map.of("message", "Invalid console token"));
            client.disconnect();
            return;
        }
        client.joinRoom(APPROVERS_ROOM);
        for (ApprovalRequest pending : approvalBroker.listPending()) {
            client.sendEvent(REQUEST_EVENT, pending);
        }
        log.info("Approver {} connected to the approval console", client.getSessionId());
    }

    void handleResolve(SocketIOClient client, ApprovalDecisionPayload payload, AckRequest ackSender) {
        try {
            if (payload == null || !StringUtils.hasText(payload.getToken())) {
                throw new IllegalArgumentException("Approval token is required");
            }
            ApprovalStatus outcome = parseOutcome(payload.getOutcome());
            ResolutionResult result = approvalBroker.resolve(payload.getToken(), outcome, payload.getReplyText());
            ApprovalResolutionResponse response = ApprovalResolutionResponse.builder()
                    .token(payload.getToken())
                    .result(result)
                    .status(approvalBroker.find(payload.getToken()).map(ApprovalRequest::getStatus).orElse(null))
                    .build();
            if (ackSender != null && ackSender.isAckRequested()) {
                ackSender.sendAckData(response);
            } else {
                client.sendEvent(RESULT_EVENT, response);
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to resolve approval from console {}", client.getSessionId(), ex);
            if (ackSender != null && ackSender.isAckRequested()) {
                ackSender.sendAckData(Map.of("error", String.valueOf(ex.getMessage())));
            } else {
                client.sendEvent(ERROR_EVENT, Map.of("message", String.valueOf(ex.getMessage())));
            }
        }
    }

    @Override
    public void present(ApprovalRequest request) {
        socketIOServer.getRoomOperations(APPROVERS_ROOM).sendEvent(REQUEST_EVENT, request);
        log.debug("Presented approval {} to the console", request.getToken());
    }

    @Override
    public void onConversationEvent(ConversationEvent event) {
        socketIOServer.getRoomOperations(APPROVERS_ROOM).sendEvent(LIFECYCLE_EVENT, event);
    }

    private ApprovalStatus parseOutcome(String outcome) {
        if (!StringUtils.hasText(outcome)) {
            throw new IllegalArgumentException("Approval outcome is required");
        }
        return switch (outcome.trim().toLowerCase(Locale.ROOT)) {
            case "approve", "approved", "yes" -> ApprovalStatus.APPROVED;
            case "reject", "rejected", "no" -> ApprovalStatus.REJECTED;
            default -> throw new IllegalArgumentException("Unsupported approval outcome: " + outcome);
        };
    }

    @PreDestroy
    public void shutdown() {
        socketIOServer.removeAllListeners(RESOLVE_EVENT);
    }
}
