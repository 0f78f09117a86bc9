package com.jeevo.validation.controller;

import com.jeevo.validation.domain.Language;
import com.jeevo.validation.dto.ApiDtos.ValidateReplyRequest;
import com.jeevo.validation.dto.ValidationDtos.ReplyRequest;
import com.jeevo.validation.dto.ValidationDtos.ValidatedReply;
import com.jeevo.validation.persistence.ResponseValidation;
import com.jeevo.validation.pipeline.MessageValidationService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/validations")
public class ValidationController {

    private final MessageValidationService service;

    public ValidationController(MessageValidationService service) {
        this.service = service;
    }

    @PostMapping
    public ResponseEntity<?> validate(@RequestBody ValidateReplyRequest request) {
        if (request.userId() == null || request.userId().isBlank()) {
            return ResponseEntity.badRequest().body("userId is required");
        }
        if (request.botResponse() == null) {
            return ResponseEntity.badRequest().body("botResponse is required");
        }
        ValidatedReply reply = service.process(new ReplyRequest(
                request.userId(),
                request.messageId(),
                request.userQuery() == null ? "" : request.userQuery(),
                request.botResponse(),
                request.baselineConfidence() == null ? 1.0 : request.baselineConfidence(),
                Language.fromCode(request.language()),
                request.useSemantic() == null || request.useSemantic()
        ));
        return ResponseEntity.ok(reply);
    }

    @GetMapping
    public List<ResponseValidation> find(@RequestParam(required = false) String userId,
                                         @RequestParam(required = false) String messageId,
                                         @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                         @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
                                         @RequestParam(defaultValue = "50") int limit) {
        return service.findValidations(userId, messageId, from, to, limit);
    }

    @GetMapping("/{id}")
    public ResponseValidation get(@PathVariable Long id) {
        return service.getValidation(id);
    }

    @GetMapping("/escalation-candidates")
    public List<ResponseValidation> escalationCandidates(@RequestParam(defaultValue = "50") int limit) {
        return service.escalationCandidates(limit);
    }
}
