package com.jeevo.validation.controller;

import com.jeevo.validation.dto.ApiDtos.ConditionDetail;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalCondition;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalSource;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/knowledge")
public class KnowledgeController {

    private final MedicalKnowledgeRepository knowledge;

    public KnowledgeController(MedicalKnowledgeRepository knowledge) {
        this.knowledge = knowledge;
    }

    @GetMapping("/sources")
    public List<MedicalSource> sources() {
        return knowledge.sources();
    }

    @GetMapping("/conditions")
    public List<MedicalCondition> conditions() {
        return knowledge.conditions();
    }

    @GetMapping("/conditions/{id}")
    public ConditionDetail condition(@PathVariable String id) {
        MedicalCondition condition = knowledge.findCondition(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition: " + id));
        return new ConditionDetail(condition, knowledge.findFactsForCondition(id));
    }
}
