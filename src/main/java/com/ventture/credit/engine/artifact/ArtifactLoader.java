package com.ventture.credit.engine.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ventture.credit.engine.FeatureSchema;
import com.ventture.credit.engine.FeatureSpec;
import com.ventture.credit.engine.ScalingMethod;
import com.ventture.credit.engine.error.ArtifactLoadException;
import com.ventture.credit.engine.model.DecisionTree;
import com.ventture.credit.engine.model.LinearScoringModel;
import com.ventture.credit.engine.model.ScoringModel;
import com.ventture.credit.engine.model.TreeEnsembleScoringModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads model and schema artifacts from their JSON form.
 *
 * <pre>
 * model  : {"type":"linear","version":"v1","featureNames":[..],"coefficients":[..],"intercept":0.0}
 *          {"type":"tree_ensemble","version":"v1","featureCount":8,"featureNames":[..],
 *           "trees":[{"nodes":[{"feature":0,"threshold":0.1,"left":1,"right":2},{"value":0.8},..]}]}
 * schema : {"version":"v1","scaling":"standard","features":[{"name":"income","center":..,"scale":..,
 *           "baseline":..,"min":..,"max":..}]}
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class ArtifactLoader {

    private final ObjectMapper objectMapper;

    public ModelBundle loadBundle(byte[] modelBytes, byte[] schemaBytes) {
        ScoringModel model = loadModel(modelBytes);
        FeatureSchema schema = loadSchema(schemaBytes);
        ModelBundle bundle = new ModelBundle(model, schema);
        log.info("Loaded model {} ({}, {} features) with schema {}",
                model.version(), model.getClass().getSimpleName(), model.featureCount(), schema.version());
        return bundle;
    }

    public ScoringModel loadModel(byte[] bytes) {
        JsonNode root = read(bytes, "model");
        String type = text(root, "type", "linear").toLowerCase(Locale.ROOT);
        String version = text(root, "version", null);
        List<String> names = strings(root.path("featureNames"));
        try {
            return switch (type) {
                case "linear", "logistic" -> new LinearScoringModel(version,
                        doubles(require(root, "coefficients")), root.path("intercept").asDouble(0.0), names);
                case "tree_ensemble", "random_forest" -> treeEnsemble(root, version, names);
                default -> throw new ArtifactLoadException("Unknown model type '" + type + "'");
            };
        } catch (IllegalArgumentException e) {
            throw new ArtifactLoadException("Invalid model artifact: " + e.getMessage(), e);
        }
    }

    public FeatureSchema loadSchema(byte[] bytes) {
        JsonNode root = read(bytes, "schema");
        JsonNode features = require(root, "features");
        if (!features.isArray()) {
            throw new ArtifactLoadException("Schema 'features' must be an array");
        }
        try {
            List<FeatureSpec> specs = new ArrayList<>();
            for (JsonNode f : features) {
                double center = require(f, "center").asDouble();
                specs.add(new FeatureSpec(
                        require(f, "name").asText(),
                        center,
                        require(f, "scale").asDouble(),
                        f.hasNonNull("baseline") ? f.get("baseline").asDouble() : center,
                        f.hasNonNull("min") ? f.get("min").asDouble() : null,
                        f.hasNonNull("max") ? f.get("max").asDouble() : null));
            }
            return new FeatureSchema(text(root, "version", null),
                    ScalingMethod.parse(text(root, "scaling", null)), specs);
        } catch (IllegalArgumentException e) {
            throw new ArtifactLoadException("Invalid schema artifact: " + e.getMessage(), e);
        }
    }

    private TreeEnsembleScoringModel treeEnsemble(JsonNode root, String version, List<String> names) {
        JsonNode treesNode = require(root, "trees");
        List<DecisionTree> trees = new ArrayList<>();
        for (JsonNode t : treesNode) {
            JsonNode nodes = require(t, "nodes");
            int n = nodes.size();
            int[] feature = new int[n];
            double[] threshold = new double[n];
            int[] left = new int[n];
            int[] right = new int[n];
            double[] value = new double[n];
            for (int i = 0; i < n; i++) {
                JsonNode node = nodes.get(i);
                if (node.has("value")) {
                    left[i] = DecisionTree.LEAF;
                    right[i] = DecisionTree.LEAF;
                    value[i] = node.get("value").asDouble();
                } else {
                    feature[i] = require(node, "feature").asInt();
                    threshold[i] = require(node, "threshold").asDouble();
                    left[i] = require(node, "left").asInt();
                    right[i] = require(node, "right").asInt();
                }
            }
            trees.add(new DecisionTree(feature, threshold, left, right, value));
        }
        int featureCount = root.hasNonNull("featureCount") ? root.get("featureCount").asInt() : names.size();
        return new TreeEnsembleScoringModel(version, featureCount, trees, names);
    }

    private JsonNode read(byte[] bytes, String what) {
        if (bytes == null || bytes.length == 0) {
            throw new ArtifactLoadException("Empty " + what + " artifact");
        }
        try {
            return objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new ArtifactLoadException("Unreadable " + what + " artifact: " + e.getMessage(), e);
        }
    }

    private static JsonNode require(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            throw new ArtifactLoadException("Artifact field '" + field + "' is missing");
        }
        return v;
    }

    private static String text(JsonNode node, String field, String def) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull()) ? def : v.asText();
    }

    private static double[] doubles(JsonNode array) {
        double[] out = new double[array.size()];
        for (int i = 0; i < out.length; i++) out[i] = array.get(i).asDouble();
        return out;
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(n -> out.add(n.asText()));
        }
        return out;
    }
}
