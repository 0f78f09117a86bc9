package com.jeevo.validation.controller;

import com.jeevo.validation.dto.ApiDtos.AvailabilityRequest;
import com.jeevo.validation.dto.ApiDtos.CaseNotesRequest;
import com.jeevo.validation.dto.ApiDtos.ExpertRequest;
import com.jeevo.validation.escalation.EscalationManager;
import com.jeevo.validation.persistence.EscalatedCase;
import com.jeevo.validation.persistence.Expert;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class EscalationController {

    private final EscalationManager escalations;

    public EscalationController(EscalationManager escalations) {
        this.escalations = escalations;
    }

    @GetMapping("/cases/{id}")
    public EscalatedCase getCase(@PathVariable Long id) {
        return escalations.getCase(id);
    }

    @GetMapping("/cases")
    public List<EscalatedCase> casesForUser(@RequestParam String userId) {
        return escalations.listForUser(userId);
    }

    @PostMapping("/cases/{id}/start")
    public EscalatedCase start(@PathVariable Long id) {
        return escalations.startReview(id);
    }

    @PostMapping("/cases/{id}/resolve")
    public EscalatedCase resolve(@PathVariable Long id, @RequestBody(required = false) CaseNotesRequest body) {
        return escalations.resolveCase(id, body == null ? null : body.notes());
    }

    @PostMapping("/cases/{id}/close")
    public EscalatedCase close(@PathVariable Long id, @RequestBody(required = false) CaseNotesRequest body) {
        return escalations.closeCase(id, body == null ? null : body.notes());
    }

    @GetMapping("/experts/{id}/cases/pending")
    public List<EscalatedCase> pending(@PathVariable Long id) {
        return escalations.listPending(id);
    }

    @GetMapping("/experts")
    public List<Expert> experts() {
        return escalations.listExperts();
    }

    @PostMapping("/experts")
    public ResponseEntity<?> register(@RequestBody ExpertRequest request) {
        if (request.name() == null || request.name().isBlank()
                || request.phoneNumber() == null || request.phoneNumber().isBlank()) {
            return ResponseEntity.badRequest().body("name and phoneNumber are required");
        }
        Expert expert = escalations.registerExpert(request.name(), request.phoneNumber(), request.specialization());
        return ResponseEntity.status(HttpStatus.CREATED).body(expert);
    }

    @PutMapping("/experts/{id}/availability")
    public Expert availability(@PathVariable Long id, @RequestBody AvailabilityRequest request) {
        return escalations.setAvailability(id, request.available());
    }
}
