package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.engine.scoring.ScoringEnsemble;
import com.medwatch.anomaly.model.ModelStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Scoring ensemble model metadata and usage statistics")
public class ModelController {

    private final ScoringEnsemble scoringEnsemble;

    public ModelController(ScoringEnsemble scoringEnsemble) {
        this.scoringEnsemble = scoringEnsemble;
    }

    @Operation(summary = "Statistics of every model",
            description = "Predictions, average latency, average confidence, detections and detection rate, keyed by model id.")
    @GetMapping
    public ResponseEntity<Map<String, ModelStats>> listModels() {
        return ResponseEntity.ok(scoringEnsemble.getModelStats());
    }

    @Operation(summary = "Statistics of one model")
    @GetMapping("/{modelId}")
    public ResponseEntity<ModelStats> getModel(
            @Parameter(description = "Model ID", example = "time-series-anomaly")
            @PathVariable String modelId) {
        ModelStats stats = scoringEnsemble.getModelStats().get(modelId);
        if (stats == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(stats);
    }
}
