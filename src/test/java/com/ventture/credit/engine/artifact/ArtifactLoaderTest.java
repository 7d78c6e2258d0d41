package com.ventture.credit.engine.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ventture.credit.engine.FeatureSchema;
import com.ventture.credit.engine.NormalizedVector;
import com.ventture.credit.engine.ScalingMethod;
import com.ventture.credit.engine.error.ArtifactLoadException;
import com.ventture.credit.engine.model.LinearScoringModel;
import com.ventture.credit.engine.model.ScoringModel;
import com.ventture.credit.engine.model.TreeEnsembleScoringModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ArtifactLoaderTest {

    private final ArtifactLoader loader = new ArtifactLoader(new ObjectMapper());

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] classpath(String path) throws IOException {
        try (InputStream in = ArtifactLoaderTest.class.getResourceAsStream(path)) {
            assertThat(in).as(path).isNotNull();
            return in.readAllBytes();
        }
    }

    @Nested
    @DisplayName("Shipped artifacts")
    class Shipped {

        @Test
        @DisplayName("the packaged model and schema form a consistent bundle")
        void packagedBundle() throws IOException {
            ModelBundle bundle = loader.loadBundle(classpath("/model/credit-model.json"),
                    classpath("/model/feature-schema.json"));

            assertThat(bundle.model()).isInstanceOf(LinearScoringModel.class);
            assertThat(bundle.schema().featureNames()).containsExactly(
                    "income", "age", "credit_amount", "guarantee_value",
                    "guarantee_credit_ratio", "liquidity_score", "income_per_age", "weighted_guarantee");
            assertThat(bundle.schema().feature(1).lowerBound()).isEqualTo(18.0);
        }

        @Test
        @DisplayName("the test forest loads as a tree ensemble")
        void forest() throws IOException {
            ScoringModel m = loader.loadModel(classpath("/model/tree-model.json"));

            assertThat(m).isInstanceOf(TreeEnsembleScoringModel.class);
            assertThat(((TreeEnsembleScoringModel) m).treeCount()).isEqualTo(2);
            assertThat(m.score(NormalizedVector.of(1.0, 1.0))).isCloseTo(0.55, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Schema parsing")
    class Schema {

        @Test
        @DisplayName("baseline defaults to the center, bounds are optional")
        void defaults() {
            FeatureSchema s = loader.loadSchema(json("""
                    {"version":"s1","scaling":"min_max","features":[
                      {"name":"a","center":1,"scale":2},
                      {"name":"b","center":0,"scale":4,"baseline":2,"max":10}
                    ]}"""));

            assertThat(s.scaling()).isEqualTo(ScalingMethod.MIN_MAX);
            assertThat(s.feature(0).baseline()).isEqualTo(1.0);
            assertThat(s.feature(0).lowerBound()).isNull();
            assertThat(s.feature(1).upperBound()).isEqualTo(10.0);
            assertThat(s.baseline().toArray()).containsExactly(0.0, 0.5);
        }

        @Test
        @DisplayName("negative scale and duplicates are rejected")
        void invalid() {
            assertThatThrownBy(() -> loader.loadSchema(json("""
                    {"features":[{"name":"a","center":1,"scale":-2}]}""")))
                    .isInstanceOf(ArtifactLoadException.class);
            assertThatThrownBy(() -> loader.loadSchema(json("""
                    {"features":[{"name":"a","center":1,"scale":2},{"name":"a","center":1,"scale":2}]}""")))
                    .isInstanceOf(ArtifactLoadException.class)
                    .hasMessageContaining("duplicate");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("unreadable bytes")
        void garbage() {
            assertThatThrownBy(() -> loader.loadModel(json("not json {")))
                    .isInstanceOf(ArtifactLoadException.class);
            assertThatThrownBy(() -> loader.loadSchema(new byte[0]))
                    .isInstanceOf(ArtifactLoadException.class);
        }

        @Test
        @DisplayName("unknown model type")
        void unknownType() {
            assertThatThrownBy(() -> loader.loadModel(json("{\"type\":\"svm\",\"coefficients\":[1]}")))
                    .isInstanceOf(ArtifactLoadException.class)
                    .hasMessageContaining("svm");
        }

        @Test
        @DisplayName("model and schema disagreeing on feature count")
        void countMismatch() {
            byte[] model = json("{\"type\":\"linear\",\"coefficients\":[1,2,3],\"intercept\":0}");
            byte[] schema = json("{\"features\":[{\"name\":\"a\",\"center\":0,\"scale\":1}]}");

            assertThatThrownBy(() -> loader.loadBundle(model, schema))
                    .isInstanceOf(ArtifactLoadException.class)
                    .hasMessageContaining("expects 3 features");
        }

        @Test
        @DisplayName("model and schema disagreeing on feature order")
        void orderMismatch() {
            byte[] model = json("{\"type\":\"linear\",\"featureNames\":[\"b\",\"a\"],\"coefficients\":[1,2]}");
            byte[] schema = json("""
                    {"features":[{"name":"a","center":0,"scale":1},{"name":"b","center":0,"scale":1}]}""");

            assertThatThrownBy(() -> loader.loadBundle(model, schema))
                    .isInstanceOf(ArtifactLoadException.class)
                    .hasMessageContaining("does not match");
        }
    }
}
