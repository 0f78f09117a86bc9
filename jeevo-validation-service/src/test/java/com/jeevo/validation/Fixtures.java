package com.jeevo.validation;

import com.jeevo.validation.knowledge.MedicalKnowledgeRepository;
import com.jeevo.validation.llm.LlmClient;
import com.jeevo.validation.rdf.RdfService;
import com.jeevo.validation.rules.DisclaimerCatalog;
import com.jeevo.validation.rules.ValidationRules;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Shared test wiring over the bundled rule tables and knowledge base.
 */
public final class Fixtures {

    private Fixtures() {}

    public static ValidationRules rules() {
        try (InputStream in = new ClassPathResource("rules/validation-rules.json").getInputStream()) {
            return ValidationRules.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static DisclaimerCatalog disclaimers() {
        try (InputStream in = new ClassPathResource("rules/default-disclaimers.json").getInputStream()) {
            return DisclaimerCatalog.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static MedicalKnowledgeRepository knowledge() {
        RdfService rdf = new RdfService(new ClassPathResource("rdf/knowledge-base.ttl"));
        rdf.loadRdfOnStartup();
        MedicalKnowledgeRepository repository = new MedicalKnowledgeRepository(rdf, 5000);
        repository.init();
        return repository;
    }

    /**
     * Provider over a single optional client; {@code null} models the LLM being disabled.
     */
    public static ObjectProvider<LlmClient> llmClient(LlmClient client) {
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        if (client != null) {
            beans.addBean("llmClient", client);
        }
        return beans.getBeanProvider(LlmClient.class);
    }
}
