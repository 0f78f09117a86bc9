package com.jeevo.validation.orchestrator;

import com.jeevo.validation.domain.EscalationTrigger;
import com.jeevo.validation.domain.RiskLevel;
import com.jeevo.validation.rules.DangerousCombination;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The validation ladder: emergencies, dangerous medication combinations, then the
 * confidence heuristics. Rule names appear in logs and audit records.
 */
public final class StandardRules {

    public static final double CONFIDENCE_THRESHOLD = 0.7;
    public static final double VERY_LOW_CONFIDENCE = 0.3;

    public static final String EMERGENCY_UNSOLICITED = "emergency_unsolicited";
    public static final String EMERGENCY_DANGEROUS_REPLY = "emergency_dangerous_reply";
    public static final String EMERGENCY_INADEQUATE_REPLY = "emergency_inadequate_reply";
    public static final String EMERGENCY_UNHANDLED = "emergency_unhandled";
    public static final String DANGEROUS_COMBINATION = "dangerous_combination";
    public static final String HIGH_RISK_LOW_CONFIDENCE = "high_risk_low_confidence";
    public static final String DANGEROUS_ADVICE = "dangerous_advice";
    public static final String GOOD_PRACTICE = "good_practice";
    public static final String MONITORED = "monitored";
    public static final String MEDICAL_TOPIC_MODERATE_CONFIDENCE = "medical_topic_moderate_confidence";
    public static final String VERY_LOW_CONFIDENCE_RULE = "very_low_confidence";
    public static final String DEFAULT = "default";

    private StandardRules() {}

    public static RuleLadder ladder() {
        return new RuleLadder(List.of(
                new Rule(EMERGENCY_UNSOLICITED,
                        s -> !s.unsolicitedEmergencies().isEmpty(),
                        s -> emergency(RiskLevel.CRITICAL, false,
                                "Response raises emergency terms the user did not mention: "
                                        + join(s.unsolicitedEmergencies()))),
                new Rule(EMERGENCY_DANGEROUS_REPLY,
                        s -> !s.emergencyInQuery().isEmpty() && !s.dangerPatterns().isEmpty(),
                        s -> emergency(RiskLevel.CRITICAL, false,
                                "Emergency (" + join(s.emergencyInQuery()) + ") answered with dismissive advice: "
                                        + join(s.dangerPatterns()))),
                new Rule(EMERGENCY_INADEQUATE_REPLY,
                        s -> !s.emergencyInQuery().isEmpty() && s.appropriateMarkers().isEmpty(),
                        s -> emergency(RiskLevel.HIGH, false,
                                "Emergency (" + join(s.emergencyInQuery()) + ") answered without directing to care")),
                new Rule(EMERGENCY_UNHANDLED,
                        HeuristicSignals::hasEmergency,
                        s -> emergency(RiskLevel.CRITICAL, true,
                                "Emergency keywords detected: " + join(s.allEmergencyKeywords()))),
                new Rule(DANGEROUS_COMBINATION,
                        s -> !s.dangerousCombinations().isEmpty(),
                        s -> Verdict.escalate(RiskLevel.HIGH, EscalationTrigger.DANGEROUS_MEDICATION_COMBINATION,
                                "Dangerous medication combination: " + s.dangerousCombinations().stream()
                                        .map(DangerousCombination::describe)
                                        .collect(Collectors.joining("; ")),
                                true, false)),
                new Rule(HIGH_RISK_LOW_CONFIDENCE,
                        s -> !s.highRiskKeywords().isEmpty() && s.baselineConfidence() < CONFIDENCE_THRESHOLD,
                        s -> Verdict.escalate(RiskLevel.HIGH, EscalationTrigger.HIGH_RISK_LOW_CONFIDENCE,
                                "High-risk topic (" + join(s.highRiskKeywords()) + ") with low confidence",
                                false, true)),
                new Rule(DANGEROUS_ADVICE,
                        s -> s.hasMedicalTopic() && s.baselineConfidence() >= CONFIDENCE_THRESHOLD
                                && !s.dangerousAdvicePhrases().isEmpty(),
                        s -> Verdict.escalate(RiskLevel.HIGH, EscalationTrigger.DANGEROUS_ADVICE_PATTERN,
                                "Dangerous advice: " + join(s.dangerousAdvicePhrases()),
                                false, false)),
                new Rule(GOOD_PRACTICE,
                        s -> s.hasMedicalTopic() && s.baselineConfidence() >= CONFIDENCE_THRESHOLD
                                && !s.goodPracticePhrases().isEmpty(),
                        s -> Verdict.deliver(RiskLevel.LOW,
                                "Medical topic answered with good practice: " + join(s.goodPracticePhrases()))),
                new Rule(MONITORED,
                        s -> s.hasMedicalTopic() && s.baselineConfidence() >= CONFIDENCE_THRESHOLD,
                        s -> Verdict.deliver(RiskLevel.MEDIUM, "Medical topic; answer should be monitored")),
                new Rule(MEDICAL_TOPIC_MODERATE_CONFIDENCE,
                        HeuristicSignals::hasMedicalTopic,
                        s -> Verdict.deliver(RiskLevel.MEDIUM, "Medical topic with moderate confidence")),
                new Rule(VERY_LOW_CONFIDENCE_RULE,
                        s -> s.baselineConfidence() < VERY_LOW_CONFIDENCE,
                        s -> Verdict.escalate(RiskLevel.HIGH, EscalationTrigger.VERY_LOW_CONFIDENCE,
                                "Very low answer confidence", false, false)),
                new Rule(DEFAULT,
                        s -> true,
                        s -> Verdict.deliver(RiskLevel.LOW, "No risk signals"))
        ));
    }

    private static Verdict emergency(RiskLevel risk, boolean answerApproved, String message) {
        return Verdict.escalate(risk, EscalationTrigger.EMERGENCY_KEYWORDS, message, true, answerApproved);
    }

    private static String join(List<String> values) {
        return String.join(", ", values);
    }
}
