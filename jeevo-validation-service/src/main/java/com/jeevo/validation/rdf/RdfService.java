package com.jeevo.validation.rdf;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.InputStream;

/**
 * Holds the medical knowledge graph in a transactional in-memory dataset.
 */
@Service
public class RdfService {

    private static final Logger log = LoggerFactory.getLogger(RdfService.class);

    private final Resource rdfFile;

    @Getter
    private final Dataset dataset = DatasetFactory.createTxnMem();

    public RdfService(@Value("${jeevo.rdf.data-file:classpath:rdf/knowledge-base.ttl}") Resource rdfFile) {
        this.rdfFile = rdfFile;
    }

    @PostConstruct
    public void loadRdfOnStartup() {
        try (InputStream in = rdfFile.getInputStream()) {
            Txn.executeWrite(dataset, () -> RDFDataMgr.read(dataset.getDefaultModel(), in, Lang.TURTLE));
            long triples = Txn.calculateRead(dataset, () -> dataset.getDefaultModel().size());
            log.info("Loaded knowledge graph from {} ({} triples)", rdfFile, triples);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load RDF file: " + rdfFile, e);
        }
    }
}
