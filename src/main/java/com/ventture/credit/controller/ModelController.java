package com.ventture.credit.controller;

import com.ventture.credit.engine.CreditDecisionEngine;
import com.ventture.credit.engine.artifact.ModelBundle;
import com.ventture.credit.service.EngineRegistry;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Tag(name = "model")
@RestController
@RequestMapping("/api/model")
@RequiredArgsConstructor
public class ModelController {

    private final EngineRegistry engines;

    /** Active model/schema pair; the UI builds its form from the feature list */
    @GetMapping
    public Map<String, Object> info() {
        CreditDecisionEngine engine = engines.current();
        return describe(engine.bundle(), engine.threshold());
    }

    /** Re-read artifacts from the configured locations; the old engine stays active on failure */
    @PostMapping("/reload")
    public Map<String, Object> reload() {
        ModelBundle bundle = engines.reload();
        return describe(bundle, engines.current().threshold());
    }

    private Map<String, Object> describe(ModelBundle bundle, double threshold) {
        var features = bundle.schema().featureNames();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("modelVersion", bundle.model().version());
        out.put("modelType", bundle.model().getClass().getSimpleName());
        out.put("schemaVersion", bundle.schema().version());
        out.put("scaling", bundle.schema().scaling());
        out.put("threshold", threshold);
        out.put("count", features.size());
        out.put("features", features);
        return out;
    }
}
