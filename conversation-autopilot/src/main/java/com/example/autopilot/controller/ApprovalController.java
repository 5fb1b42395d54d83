package com.example.autopilot.controller;

import com.example.autopilot.domain.ApprovalRequest;
import com.example.autopilot.domain.ApprovalStatus;
import com.example.autopilot.dto.ApprovalDecisionRequest;
import com.example.autopilot.dto.ApprovalResolutionResponse;
import com.example.autopilot.service.ApprovalBroker;
import com.example.autopilot.service.ResolutionResult;
import com.example.autopilot.service.exception.ServiceException;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalBroker approvalBroker;

    @GetMapping
    public ResponseEntity<List<ApprovalRequest>> listPending() {
        return ResponseEntity.ok(approvalBroker.listPending());
    }

    @GetMapping("/{token}")
    public ResponseEntity<ApprovalRequest> getApproval(@PathVariable String token) {
        return ResponseEntity.ok(approvalBroker.find(token)
                .orElseThrow(() -> new ServiceException(HttpStatus.NOT_FOUND, "Approval not found", "approval_not_found")));
    }

    @PostMapping("/{token}/approve")
    public ResponseEntity<ApprovalResolutionResponse> approve(
            @PathVariable String token,
            @Valid @RequestBody(required = false) ApprovalDecisionRequest request) {
        String replyText = request != null ? request.getReplyText() : null;
        return respond(token, approvalBroker.resolve(token, ApprovalStatus.APPROVED, replyText));
    }

    @PostMapping("/{token}/reject")
    public ResponseEntity<ApprovalResolutionResponse> reject(@PathVariable String token) {
        return respond(token, approvalBroker.resolve(token, ApprovalStatus.REJECTED, null));
    }

    private ResponseEntity<ApprovalResolutionResponse> respond(String token, ResolutionResult result) {
        ApprovalResolutionResponse.ApprovalResolutionResponseBuilder response = ApprovalResolutionResponse.builder()
                .token(token)
                .result(result);
        return switch (result) {
            case UNKNOWN_TOKEN -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(response.build());
            case ALREADY_TERMINAL -> ResponseEntity.status(HttpStatus.CONFLICT).body(response
                    .status(approvalBroker.find(token).map(ApprovalRequest::getStatus).orElse(null))
                    .build());
            case APPLIED -> ResponseEntity.ok(response
                    .status(approvalBroker.find(token).map(ApprovalRequest::getStatus).orElse(null))
                    .build());
        };
    }
}
