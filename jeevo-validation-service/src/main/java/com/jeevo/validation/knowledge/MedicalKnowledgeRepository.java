package com.jeevo.validation.knowledge;

import com.jeevo.validation.domain.FactType;
import com.jeevo.validation.exception.KnowledgeLookupException;
import com.jeevo.validation.rdf.RdfService;
import com.jeevo.validation.rules.KeywordMatcher;
import jakarta.annotation.PostConstruct;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Read-mostly view of the knowledge graph. Sources, conditions and facts are loaded with SPARQL
 * into an immutable snapshot that lookups read without touching the dataset.
 */
@Component
public class MedicalKnowledgeRepository {

    private static final Logger log = LoggerFactory.getLogger(MedicalKnowledgeRepository.class);

    private static final String PREFIXES = """
            PREFIX schema: <https://schema.org/>
            PREFIX kb: <https://jeevo.example/kb#>
            """;

    private final RdfService rdf;
    private final long queryTimeoutMs;
    private volatile Snapshot snapshot;

    public MedicalKnowledgeRepository(RdfService rdf,
                                      @Value("${jeevo.rdf.query-timeout-ms:5000}") long queryTimeoutMs) {
        this.rdf = rdf;
        this.queryTimeoutMs = queryTimeoutMs;
    }

    public record MedicalSource(
            String id,
            String name,
            int authorityLevel,
            String url,
            String description
    ) {}

    public record Contraindication(
            String id,
            String description,
            List<String> substances,
            String population,
            List<String> populationTerms
    ) {
        public boolean isPopulationScoped() {
            return !populationTerms.isEmpty();
        }
    }

    public record MedicalCondition(
            String id,
            String name,
            String icd10Code,
            List<String> aliases,
            List<String> symptoms,
            List<String> treatments,
            List<String> prevention,
            List<String> warningSigns,
            List<Contraindication> contraindications,
            List<String> sourceIds
    ) {}

    /**
     * One atomic sourced statement. {@code confidence} is null when the source states none.
     */
    public record MedicalFact(
            String id,
            String conditionId,
            String sourceId,
            FactType type,
            String text,
            Double confidence
    ) {}

    private record Snapshot(
            List<MedicalSource> sources,
            Map<String, MedicalSource> sourcesById,
            List<MedicalCondition> conditions,
            Map<String, MedicalCondition> conditionsById,
            List<MedicalFact> facts
    ) {}

    @PostConstruct
    public void init() {
        refresh();
    }

    /**
     * Reloads the snapshot from the dataset. A failed reload keeps the previous snapshot.
     */
    public void refresh() {
        try {
            Snapshot loaded = Txn.calculateRead(rdf.getDataset(), this::load);
            snapshot = loaded;
            log.info("Knowledge base ready: {} sources, {} conditions, {} facts",
                    loaded.sources().size(), loaded.conditions().size(), loaded.facts().size());
        } catch (RuntimeException e) {
            throw new KnowledgeLookupException("Failed to load knowledge base", e);
        }
    }

    /** Sources ordered by authority level, most authoritative first. */
    public List<MedicalSource> sources() {
        return current().sources();
    }

    public Optional<MedicalSource> findSource(String id) {
        return Optional.ofNullable(current().sourcesById().get(id));
    }

    public List<MedicalCondition> conditions() {
        return current().conditions();
    }

    public Optional<MedicalCondition> findCondition(String id) {
        return Optional.ofNullable(current().conditionsById().get(id));
    }

    /**
     * Facts of one type, optionally scoped to a condition.
     */
    public List<MedicalFact> findFacts(FactType type, String conditionId) {
        return current().facts().stream()
                .filter(f -> f.type() == type)
                .filter(f -> conditionId == null || conditionId.equals(f.conditionId()))
                .toList();
    }

    public List<MedicalFact> findFactsForCondition(String conditionId) {
        return current().facts().stream()
                .filter(f -> f.conditionId().equals(conditionId))
                .toList();
    }

    /**
     * Conditions whose name, identifier or an alias occurs in the text.
     */
    public List<MedicalCondition> findConditionsMentionedIn(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<MedicalCondition> mentioned = new ArrayList<>();
        for (MedicalCondition condition : current().conditions()) {
            boolean hit = KeywordMatcher.containsTerm(text, condition.name())
                    || KeywordMatcher.containsTerm(text, condition.id())
                    || condition.aliases().stream().anyMatch(alias -> KeywordMatcher.containsTerm(text, alias));
            if (hit) {
                mentioned.add(condition);
            }
        }
        return mentioned;
    }

    private Snapshot current() {
        Snapshot s = snapshot;
        if (s == null) {
            throw new KnowledgeLookupException("Knowledge base is not loaded");
        }
        return s;
    }

    private Snapshot load() {
        List<MedicalSource> sources = fetchSources();
        Map<String, MedicalSource> sourcesById = new LinkedHashMap<>();
        sources.forEach(s -> sourcesById.put(s.id(), s));

        List<MedicalCondition> conditions = fetchConditions();
        Map<String, MedicalCondition> conditionsById = new LinkedHashMap<>();
        conditions.forEach(c -> conditionsById.put(c.id(), c));

        List<MedicalFact> facts = new ArrayList<>();
        for (MedicalCondition condition : conditions) {
            for (String sourceId : condition.sourceIds()) {
                addFacts(facts, condition, sourceId, FactType.SYMPTOM, condition.symptoms());
                addFacts(facts, condition, sourceId, FactType.TREATMENT, condition.treatments());
                addFacts(facts, condition, sourceId, FactType.PREVENTION, condition.prevention());
            }
        }
        facts.addAll(fetchCuratedFacts());

        return new Snapshot(List.copyOf(sources), Map.copyOf(sourcesById),
                List.copyOf(conditions), Map.copyOf(conditionsById), List.copyOf(facts));
    }

    private static void addFacts(List<MedicalFact> facts, MedicalCondition condition, String sourceId,
                                 FactType type, List<String> items) {
        for (int i = 0; i < items.size(); i++) {
            String id = condition.id() + "/" + type.value() + "/" + sourceId + "/" + i;
            facts.add(new MedicalFact(id, condition.id(), sourceId, type, items.get(i), null));
        }
    }

    private List<MedicalSource> fetchSources() {
        String query = PREFIXES + """
                SELECT ?id ?name ?level ?url ?description WHERE {
                  ?source a kb:MedicalSource ;
                          schema:identifier ?id ;
                          schema:name ?name ;
                          kb:authorityLevel ?level .
                  OPTIONAL { ?source schema:url ?url }
                  OPTIONAL { ?source schema:description ?description }
                }
                ORDER BY ?level ?id
                """;
        List<MedicalSource> sources = new ArrayList<>();
        select(query, row -> sources.add(new MedicalSource(
                row.getLiteral("id").getString(),
                row.getLiteral("name").getString(),
                row.getLiteral("level").getInt(),
                nodeText(row.get("url")),
                nodeText(row.get("description"))
        )));
        sources.sort(Comparator.comparingInt(MedicalSource::authorityLevel).thenComparing(MedicalSource::id));
        return sources;
    }

    private List<MedicalCondition> fetchConditions() {
        String baseQuery = PREFIXES + """
                SELECT ?id ?name ?icd WHERE {
                  ?condition a schema:MedicalCondition ;
                             schema:identifier ?id ;
                             schema:name ?name .
                  OPTIONAL { ?condition kb:icd10Code ?icd }
                }
                ORDER BY ?id
                """;
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, String> icdCodes = new LinkedHashMap<>();
        select(baseQuery, row -> {
            String id = row.getLiteral("id").getString();
            names.putIfAbsent(id, row.getLiteral("name").getString());
            String icd = nodeText(row.get("icd"));
            if (icd != null) icdCodes.putIfAbsent(id, icd);
        });

        Map<String, List<String>> aliases = fetchLiterals("kb:alias");
        Map<String, List<String>> symptoms = fetchLiterals("schema:signOrSymptom");
        Map<String, List<String>> treatments = fetchLiterals("kb:treatment");
        Map<String, List<String>> prevention = fetchLiterals("kb:prevention");
        Map<String, List<String>> warningSigns = fetchLiterals("kb:warningSign");
        Map<String, List<String>> citedBy = fetchCitations();
        Map<String, List<Contraindication>> contraindications = fetchContraindications();

        List<MedicalCondition> conditions = new ArrayList<>();
        for (Map.Entry<String, String> entry : names.entrySet()) {
            String id = entry.getKey();
            conditions.add(new MedicalCondition(
                    id,
                    entry.getValue(),
                    icdCodes.get(id),
                    aliases.getOrDefault(id, List.of()),
                    symptoms.getOrDefault(id, List.of()),
                    treatments.getOrDefault(id, List.of()),
                    prevention.getOrDefault(id, List.of()),
                    warningSigns.getOrDefault(id, List.of()),
                    contraindications.getOrDefault(id, List.of()),
                    citedBy.getOrDefault(id, List.of())
            ));
        }
        return conditions;
    }

    private Map<String, List<String>> fetchLiterals(String predicate) {
        String query = PREFIXES + """
                SELECT ?id ?value WHERE {
                  ?condition a schema:MedicalCondition ;
                             schema:identifier ?id ;
                             %s ?value .
                  FILTER(isLiteral(?value))
                }
                ORDER BY ?id ?value
                """.formatted(predicate);
        Map<String, List<String>> values = new LinkedHashMap<>();
        select(query, row -> values
                .computeIfAbsent(row.getLiteral("id").getString(), k -> new ArrayList<>())
                .add(row.getLiteral("value").getString()));
        values.replaceAll((k, v) -> List.copyOf(v));
        return values;
    }

    private Map<String, List<String>> fetchCitations() {
        String query = PREFIXES + """
                SELECT ?id ?sourceId ?level WHERE {
                  ?condition a schema:MedicalCondition ;
                             schema:identifier ?id ;
                             kb:citedBy ?source .
                  ?source schema:identifier ?sourceId ;
                          kb:authorityLevel ?level .
                }
                ORDER BY ?id ?level ?sourceId
                """;
        Map<String, List<String>> citations = new LinkedHashMap<>();
        select(query, row -> citations
                .computeIfAbsent(row.getLiteral("id").getString(), k -> new ArrayList<>())
                .add(row.getLiteral("sourceId").getString()));
        citations.replaceAll((k, v) -> List.copyOf(v));
        return citations;
    }

    private Map<String, List<Contraindication>> fetchContraindications() {
        String query = PREFIXES + """
                SELECT ?id ?entry ?description ?substance ?population ?populationTerm WHERE {
                  ?condition a schema:MedicalCondition ;
                             schema:identifier ?id ;
                             kb:contraindication ?entry .
                  ?entry schema:description ?description ;
                         kb:substance ?substance .
                  OPTIONAL { ?entry kb:population ?population }
                  OPTIONAL { ?entry kb:populationTerm ?populationTerm }
                }
                ORDER BY ?id ?entry ?substance ?populationTerm
                """;

        Map<String, ContraindicationRows> rows = new LinkedHashMap<>();
        select(query, row -> {
            ContraindicationRows r = rows.computeIfAbsent(row.getResource("entry").toString(),
                    k -> new ContraindicationRows(row.getLiteral("id").getString(),
                            row.getLiteral("description").getString()));
            r.substances.add(row.getLiteral("substance").getString());
            String population = nodeText(row.get("population"));
            if (population != null) r.population = population;
            String term = nodeText(row.get("populationTerm"));
            if (term != null) r.populationTerms.add(term);
        });

        Map<String, List<Contraindication>> byCondition = new LinkedHashMap<>();
        rows.forEach((entry, r) -> byCondition
                .computeIfAbsent(r.conditionId, k -> new ArrayList<>())
                .add(new Contraindication(localName(entry), r.description, List.copyOf(r.substances),
                        r.population, List.copyOf(r.populationTerms))));
        byCondition.replaceAll((k, v) -> List.copyOf(v));
        return byCondition;
    }

    private List<MedicalFact> fetchCuratedFacts() {
        String query = PREFIXES + """
                SELECT ?fact ?conditionId ?sourceId ?type ?text ?confidence WHERE {
                  ?fact a kb:MedicalFact ;
                        kb:aboutCondition ?condition ;
                        kb:source ?source ;
                        kb:factType ?type ;
                        kb:factText ?text .
                  ?condition schema:identifier ?conditionId .
                  ?source schema:identifier ?sourceId .
                  OPTIONAL { ?fact kb:confidence ?confidence }
                }
                ORDER BY ?fact
                """;
        List<MedicalFact> facts = new ArrayList<>();
        select(query, row -> {
            RDFNode confidence = row.get("confidence");
            facts.add(new MedicalFact(
                    localName(row.getResource("fact").toString()),
                    row.getLiteral("conditionId").getString(),
                    row.getLiteral("sourceId").getString(),
                    FactType.fromValue(row.getLiteral("type").getString()),
                    row.getLiteral("text").getString(),
                    confidence == null ? null : confidence.asLiteral().getDouble()
            ));
        });
        return facts;
    }

    private void select(String sparqlQuery, Consumer<QuerySolution> consumer) {
        try (QueryExecution queryExecution = QueryExecution.create()
                .dataset(rdf.getDataset())
                .query(sparqlQuery)
                .timeout(queryTimeoutMs, TimeUnit.MILLISECONDS)
                .build()) {
            ResultSet resultSet = queryExecution.execSelect();
            while (resultSet.hasNext()) {
                consumer.accept(resultSet.next());
            }
        }
    }

    private static final class ContraindicationRows {
        private final String conditionId;
        private final String description;
        private final Set<String> substances = new LinkedHashSet<>();
        private final Set<String> populationTerms = new LinkedHashSet<>();
        private String population;

        private ContraindicationRows(String conditionId, String description) {
            this.conditionId = conditionId;
            this.description = description;
        }
    }

    private static String nodeText(RDFNode node) {
        if (node == null) return null;
        if (node.isLiteral()) return node.asLiteral().getString();
        if (node.isURIResource()) return node.asResource().getURI();
        return node.toString();
    }

    private static String localName(String uri) {
        int hash = uri.lastIndexOf('#');
        return hash >= 0 ? uri.substring(hash + 1) : uri;
    }
}
