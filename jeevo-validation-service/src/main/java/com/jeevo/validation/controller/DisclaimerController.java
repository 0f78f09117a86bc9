package com.jeevo.validation.controller;

import com.jeevo.validation.disclaimer.DisclaimerSelector;
import com.jeevo.validation.domain.Language;
import com.jeevo.validation.domain.RiskLevel;
import com.jeevo.validation.dto.ApiDtos.DisclaimerOverrideRequest;
import com.jeevo.validation.persistence.Disclaimer;
import com.jeevo.validation.persistence.DisclaimerTracking;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/disclaimers")
public class DisclaimerController {

    private final DisclaimerSelector selector;

    public DisclaimerController(DisclaimerSelector selector) {
        this.selector = selector;
    }

    @GetMapping
    public ResponseEntity<?> get(@RequestParam String riskLevel,
                                 @RequestParam(defaultValue = "en") String language) {
        RiskLevel risk;
        try {
            risk = RiskLevel.fromValue(riskLevel);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Unknown risk level: " + riskLevel);
        }
        return ResponseEntity.ok(selector.getDisclaimer(risk, Language.fromCode(language)));
    }

    @PutMapping
    public ResponseEntity<?> override(@RequestBody DisclaimerOverrideRequest request) {
        RiskLevel risk;
        try {
            risk = RiskLevel.fromValue(request.riskLevel());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Unknown risk level: " + request.riskLevel());
        }
        if (request.content() == null || request.content().isBlank()) {
            return ResponseEntity.badRequest().body("content is required");
        }
        int priority = request.priority() == null ? 1 : request.priority();
        Disclaimer saved = selector.override(risk, Language.fromCode(request.language()), request.content(), priority);
        return ResponseEntity.ok(saved);
    }

    @GetMapping("/history")
    public List<DisclaimerTracking> history(@RequestParam String userId,
                                            @RequestParam(defaultValue = "20") int limit) {
        return selector.history(userId, limit);
    }
}
