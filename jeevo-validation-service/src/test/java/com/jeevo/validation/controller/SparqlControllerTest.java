package com.jeevo.validation.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SparqlControllerTest {

    private static final String PREFIXES = """
            PREFIX schema: <https://schema.org/>
            PREFIX kb: <https://jeevo.example/kb#>
            """;

    @Autowired
    MockMvc mvc;

    @Test
    void sparqlSelectReturnsJson() throws Exception {
        String q = PREFIXES + """
                SELECT ?s ?name WHERE {
                  ?s a kb:MedicalSource ;
                     schema:name ?name .
                } LIMIT 5
                """;

        mvc.perform(post("/api/v1/sparql")
                        .contentType("application/sparql-query")
                        .content(q))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/sparql-results+json"))
                .andExpect(jsonPath("$.results.bindings.length()").value(5));
    }

    @Test
    void sparqlAskReturnsBoolean() throws Exception {
        String q = PREFIXES + "ASK { ?c a schema:MedicalCondition ; schema:name \"Malaria\" }";

        mvc.perform(post("/api/v1/sparql")
                        .contentType("application/sparql-query")
                        .content(q))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/sparql-results+json"))
                .andExpect(jsonPath("$.boolean").value(true));
    }

    @Test
    void graphQueriesAreRejected() throws Exception {
        String q = PREFIXES + "CONSTRUCT { ?s schema:name ?name } WHERE { ?s a kb:MedicalSource ; schema:name ?name }";

        mvc.perform(post("/api/v1/sparql")
                        .contentType("text/plain")
                        .content(q))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Only SELECT and ASK queries are supported."));

        mvc.perform(post("/api/v1/sparql")
                        .contentType("application/sparql-query")
                        .content(PREFIXES + "DESCRIBE kb:who"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void selectWithoutLimitIsRejected() throws Exception {
        mvc.perform(post("/api/v1/sparql")
                        .contentType("application/sparql-query")
                        .content(PREFIXES + "SELECT ?s WHERE { ?s a schema:MedicalCondition }"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("SELECT queries must have a LIMIT clause."));
    }

    @Test
    void updatesDoNotParse() throws Exception {
        mvc.perform(post("/api/v1/sparql")
                        .contentType("application/sparql-query")
                        .content(PREFIXES + "DELETE WHERE { ?s ?p ?o }"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void oversizedQueryIsRejected() throws Exception {
        String q = PREFIXES + "SELECT ?s WHERE { ?s ?p ?o } LIMIT 1 #" + "x".repeat(2100);

        mvc.perform(post("/api/v1/sparql")
                        .contentType("application/sparql-query")
                        .content(q))
                .andExpect(status().isPayloadTooLarge());
    }
}
