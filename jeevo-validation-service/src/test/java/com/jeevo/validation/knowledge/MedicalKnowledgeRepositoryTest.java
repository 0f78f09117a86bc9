package com.jeevo.validation.knowledge;

import com.jeevo.validation.Fixtures;
import com.jeevo.validation.domain.FactType;
import com.jeevo.validation.exception.KnowledgeLookupException;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalCondition;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalFact;
import com.jeevo.validation.knowledge.MedicalKnowledgeRepository.MedicalSource;
import com.jeevo.validation.rdf.RdfService;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MedicalKnowledgeRepositoryTest {

    private static MedicalKnowledgeRepository knowledge;

    @BeforeAll
    static void load() {
        knowledge = Fixtures.knowledge();
    }

    @Test
    void sources_areOrderedByAuthority() {
        List<MedicalSource> sources = knowledge.sources();

        assertThat(sources).extracting(MedicalSource::id)
                .containsExactly("ICMR", "MOH_INDIA", "NACO", "WHO", "IAP", "NIH");
        assertThat(knowledge.findSource("WHO")).get()
                .extracting(MedicalSource::url).isEqualTo("https://www.who.int/");
    }

    @Test
    void conditions_carryCodesAndContraindications() {
        assertThat(knowledge.conditions()).hasSize(10);

        MedicalCondition fever = knowledge.findCondition("fever").orElseThrow();
        assertThat(fever.icd10Code()).isEqualTo("R50");
        assertThat(fever.sourceIds()).containsExactly("MOH_INDIA", "WHO");
        assertThat(fever.contraindications()).singleElement()
                .satisfies(c -> {
                    assertThat(c.substances()).contains("aspirin");
                    assertThat(c.isPopulationScoped()).isTrue();
                });
        assertThat(knowledge.findCondition("nope")).isEmpty();
    }

    @Test
    void facts_reference_oneConditionAndOneKnownSource() {
        for (MedicalCondition condition : knowledge.conditions()) {
            for (MedicalFact fact : knowledge.findFactsForCondition(condition.id())) {
                assertThat(fact.conditionId()).isEqualTo(condition.id());
                assertThat(knowledge.findSource(fact.sourceId())).isPresent();
            }
        }
    }

    @Test
    void facts_areMaterializedPerCitingSource_plusCuratedOnes() {
        List<MedicalFact> malariaPrevention = knowledge.findFacts(FactType.PREVENTION, "malaria");

        assertThat(malariaPrevention).filteredOn(f -> f.text().equals("treated bed nets"))
                .extracting(MedicalFact::sourceId)
                .containsExactlyInAnyOrder("WHO", "MOH_INDIA", "NACO");
        assertThat(malariaPrevention).filteredOn(f -> f.id().equals("fact-malaria-itn"))
                .singleElement()
                .satisfies(f -> assertThat(f.confidence()).isEqualTo(0.95));
    }

    @Test
    void findFacts_withoutCondition_spansAllConditions() {
        assertThat(knowledge.findFacts(FactType.TREATMENT, null))
                .extracting(MedicalFact::conditionId)
                .contains("fever", "diarrhea", "dengue", "tuberculosis");
    }

    @Test
    void conditionsMentioned_matchNamesIdsAndAliases() {
        assertThat(knowledge.findConditionsMentionedIn("my child has loose motions"))
                .extracting(MedicalCondition::id).containsExactly("diarrhea");
        assertThat(knowledge.findConditionsMentionedIn("Is TB contagious?"))
                .extracting(MedicalCondition::id).containsExactly("tuberculosis");
        assertThat(knowledge.findConditionsMentionedIn("I have dengue"))
                .extracting(MedicalCondition::id).containsExactly("dengue");
        assertThat(knowledge.findConditionsMentionedIn("")).isEmpty();
    }

    @Test
    void lookupsBeforeLoading_fail() {
        RdfService rdf = new RdfService(new ClassPathResource("rdf/knowledge-base.ttl"));
        MedicalKnowledgeRepository unloaded = new MedicalKnowledgeRepository(rdf, 5000);

        assertThatThrownBy(unloaded::sources).isInstanceOf(KnowledgeLookupException.class);
    }
}
