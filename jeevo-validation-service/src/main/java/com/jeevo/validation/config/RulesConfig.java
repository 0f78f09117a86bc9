package com.jeevo.validation.config;

import com.jeevo.validation.rules.DisclaimerCatalog;
import com.jeevo.validation.rules.ValidationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.InputStream;

@Configuration
public class RulesConfig {

    private static final Logger log = LoggerFactory.getLogger(RulesConfig.class);

    @Bean
    public ValidationRules validationRules(
            @Value("${jeevo.validation.rules-file:classpath:rules/validation-rules.json}") Resource rulesFile) {
        try (InputStream in = rulesFile.getInputStream()) {
            ValidationRules rules = ValidationRules.load(in);
            log.info("Loaded validation rules: {} emergency keywords, {} high-risk keywords, {} medication combinations",
                    rules.emergencyKeywords().size(), rules.highRiskKeywords().size(), rules.dangerousCombinations().size());
            return rules;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load validation rules: " + rulesFile, e);
        }
    }

    @Bean
    public DisclaimerCatalog disclaimerCatalog(
            @Value("${jeevo.validation.disclaimers-file:classpath:rules/default-disclaimers.json}") Resource disclaimersFile) {
        try (InputStream in = disclaimersFile.getInputStream()) {
            return DisclaimerCatalog.load(in);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load default disclaimers: " + disclaimersFile, e);
        }
    }
}
