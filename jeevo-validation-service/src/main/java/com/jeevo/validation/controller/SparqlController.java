package com.jeevo.validation.controller;

import com.jeevo.validation.rdf.RdfService;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryCancelledException;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.QueryParseException;
import org.apache.jena.riot.resultset.ResultSetLang;
import org.apache.jena.sparql.resultset.ResultsWriter;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Read-only SPARQL over the knowledge graph for inspecting sources, conditions and facts.
 * Accepts bounded SELECT and ASK queries and answers in SPARQL JSON results.
 */
@RestController
@RequestMapping("/api/v1/sparql")
public class SparqlController {

    private static final Logger log = LoggerFactory.getLogger(SparqlController.class);

    private static final String APPLICATION_SPARQL_QUERY = "application/sparql-query";
    private static final MediaType SPARQL_RESULTS_JSON = MediaType.valueOf("application/sparql-results+json");

    private static final int MAX_QUERY_LENGTH = 2000;

    private final RdfService rdfService;
    private final long queryTimeoutMs;

    public SparqlController(RdfService rdfService,
                            @Value("${jeevo.rdf.query-timeout-ms:5000}") long queryTimeoutMs) {
        this.rdfService = rdfService;
        this.queryTimeoutMs = queryTimeoutMs;
    }

    @PostMapping(consumes = {APPLICATION_SPARQL_QUERY, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<String> query(@RequestBody String queryString) {
        if (queryString.length() > MAX_QUERY_LENGTH) {
            return plain(HttpStatus.PAYLOAD_TOO_LARGE, "Query too long. Max allowed: " + MAX_QUERY_LENGTH);
        }

        Query query;
        try {
            query = QueryFactory.create(queryString);
        } catch (QueryParseException e) {
            return plain(HttpStatus.BAD_REQUEST, "SPARQL parse error:\n" + e.getMessage());
        }
        if (!query.isSelectType() && !query.isAskType()) {
            return plain(HttpStatus.BAD_REQUEST, "Only SELECT and ASK queries are supported.");
        }
        if (query.isSelectType() && !query.hasLimit()) {
            return plain(HttpStatus.BAD_REQUEST, "SELECT queries must have a LIMIT clause.");
        }

        try {
            String body = Txn.calculateRead(rdfService.getDataset(), () -> run(query));
            return ResponseEntity.ok().contentType(SPARQL_RESULTS_JSON).body(body);
        } catch (QueryCancelledException e) {
            log.warn("SPARQL query timed out after {} ms", queryTimeoutMs);
            return plain(HttpStatus.SERVICE_UNAVAILABLE, "Query timed out after " + queryTimeoutMs + " ms");
        } catch (RuntimeException e) {
            log.error("SPARQL execution error: {}", e.getMessage());
            return plain(HttpStatus.INTERNAL_SERVER_ERROR, "Query execution error:\n" + e.getMessage());
        }
    }

    private String run(Query query) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ResultsWriter writer = ResultsWriter.create().lang(ResultSetLang.RS_JSON).build();
        try (QueryExecution execution = QueryExecution.create()
                .dataset(rdfService.getDataset())
                .query(query)
                .timeout(queryTimeoutMs, TimeUnit.MILLISECONDS)
                .build()) {
            if (query.isAskType()) {
                writer.write(out, execution.execAsk());
            } else {
                writer.write(out, execution.execSelect());
            }
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static ResponseEntity<String> plain(HttpStatus status, String message) {
        return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(message);
    }
}
