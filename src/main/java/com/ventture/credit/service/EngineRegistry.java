package com.ventture.credit.service;

import com.ventture.credit.config.CreditEngineProperties;
import com.ventture.credit.engine.CreditDecisionEngine;
import com.ventture.credit.engine.artifact.ArtifactLoader;
import com.ventture.credit.engine.artifact.ModelBundle;
import com.ventture.credit.engine.error.ArtifactLoadException;
import com.ventture.credit.engine.explain.ExplanationEngine;
import com.ventture.credit.engine.model.DecisionModel;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active {@link CreditDecisionEngine}. The engine is loaded during context startup, so a bad
 * artifact stops the application before it accepts requests. Reloads build a complete engine first and
 * then swap it in; readers never observe a half-loaded model/schema pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EngineRegistry {

    private final ArtifactLoader artifactLoader;
    private final DecisionModel decisionModel;
    private final ExplanationEngine explanationEngine;
    private final CreditEngineProperties props;
    private final ResourceLoader resourceLoader;

    private final AtomicReference<CreditDecisionEngine> current = new AtomicReference<>();

    @PostConstruct
    public void init() {
        reload();
    }

    public CreditDecisionEngine current() {
        CreditDecisionEngine engine = current.get();
        if (engine == null) {
            throw new IllegalStateException("Decision engine not initialized");
        }
        return engine;
    }

    /** Reloads model and schema from the configured locations. */
    public ModelBundle reload() {
        byte[] model = read(props.getModelLocation());
        byte[] schema = read(props.getSchemaLocation());
        return reload(model, schema);
    }

    public ModelBundle reload(byte[] modelBytes, byte[] schemaBytes) {
        ModelBundle bundle = artifactLoader.loadBundle(modelBytes, schemaBytes);
        CreditDecisionEngine engine = new CreditDecisionEngine(bundle, decisionModel, explanationEngine);
        CreditDecisionEngine previous = current.getAndSet(engine);
        if (previous != null) {
            log.info("Swapped model {} -> {}", previous.bundle().model().version(), bundle.model().version());
        }
        return bundle;
    }

    private byte[] read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ArtifactLoadException("Artifact not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new ArtifactLoadException("Cannot read artifact " + location + ": " + e.getMessage(), e);
        }
    }
}
