package com.phillippitts.phiredaction.presentation.controller;

import com.phillippitts.phiredaction.presentation.dto.EgressRequestBody;
import com.phillippitts.phiredaction.service.policy.EgressRequest;
import com.phillippitts.phiredaction.service.policy.PolicyGate;
import com.phillippitts.phiredaction.service.policy.ReleasedText;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Outbound release through the policy gate. Blocked releases surface as 403.
 */
@RestController
@RequestMapping("/redaction")
class EgressController {

    private final PolicyGate policyGate;

    EgressController(PolicyGate policyGate) {
        this.policyGate = policyGate;
    }

    @PostMapping("/egress")
    ResponseEntity<ReleasedText> release(@Valid @RequestBody EgressRequestBody body) {
        return ResponseEntity.ok(policyGate.release(
                new EgressRequest(body.snapshotId(), body.acceptedEntityIds(), body.destination())));
    }
}
