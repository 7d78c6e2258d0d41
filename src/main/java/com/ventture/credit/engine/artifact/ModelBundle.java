package com.ventture.credit.engine.artifact;

import com.ventture.credit.engine.FeatureSchema;
import com.ventture.credit.engine.error.ArtifactLoadException;
import com.ventture.credit.engine.model.ScoringModel;

import java.util.List;

/**
 * A model and the schema it was trained with. Constructed only for consistent pairs:
 * same feature count, and same names in the same order when the model records them.
 */
public record ModelBundle(ScoringModel model, FeatureSchema schema) {

    public ModelBundle {
        if (model == null || schema == null) {
            throw new ArtifactLoadException("Model and schema must both be present");
        }
        if (model.featureCount() != schema.size()) {
            throw new ArtifactLoadException("Model " + model.version() + " expects " + model.featureCount()
                    + " features but schema " + schema.version() + " declares " + schema.size());
        }
        List<String> names = model.featureNames();
        if (!names.isEmpty() && !names.equals(schema.featureNames())) {
            throw new ArtifactLoadException("Feature order of model " + model.version()
                    + " " + names + " does not match schema " + schema.version() + " " + schema.featureNames());
        }
    }
}
