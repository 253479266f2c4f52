package com.jreinhal.compass.controller;

import com.jreinhal.compass.autonomous.accuracy.SchemaOptimizer;
import com.jreinhal.compass.autonomous.accuracy.TestRunOptions;
import com.jreinhal.compass.autonomous.accuracy.TestSuiteResult;
import com.jreinhal.compass.autonomous.groundtruth.ExtractionConfig;
import com.jreinhal.compass.autonomous.groundtruth.GroundTruthService;
import com.jreinhal.compass.autonomous.groundtruth.SourceSheet;
import com.jreinhal.compass.autonomous.orchestrator.GroundTruthSource;
import com.jreinhal.compass.autonomous.orchestrator.OrchestratorConfig;
import com.jreinhal.compass.autonomous.orchestrator.PipelineOrchestrator;
import com.jreinhal.compass.model.AccuracyTestCase;
import com.jreinhal.compass.model.GroundTruthRecord;
import com.jreinhal.compass.model.OptimizationAction;
import com.jreinhal.compass.model.PipelineRun;
import com.jreinhal.compass.model.TestPriority;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ground truth, accuracy tests and the self-improvement loop.
 */
@RestController
@RequestMapping("/api/autonomous")
public class AutonomousPipelineController {

    private static final Logger log = LoggerFactory.getLogger(AutonomousPipelineController.class);

    private final PipelineOrchestrator orchestrator;
    private final GroundTruthService groundTruthService;
    private final SchemaOptimizer optimizer;

    public AutonomousPipelineController(PipelineOrchestrator orchestrator, GroundTruthService groundTruthService,
                                        SchemaOptimizer optimizer) {
        this.orchestrator = orchestrator;
        this.groundTruthService = groundTruthService;
        this.optimizer = optimizer;
    }

    /**
     * Null fields fall back to the configured defaults.
     */
    public record RunRequest(String documentId,
                             Integer maxIterations,
                             Double targetAccuracy,
                             Boolean dryRun,
                             Boolean skipGroundTruth,
                             Integer maxActionsPerIteration,
                             Set<String> categories,
                             Set<TestPriority> priorities,
                             GroundTruthRequest groundTruth) {
    }

    public record GroundTruthRequest(String documentId, String keyColumn, String periodColumn, List<String> fields,
                                     Double minConfidence, SourceSheet sheet) {

        ExtractionConfig toConfig(String namespace) {
            ExtractionConfig config = ExtractionConfig.of(namespace, documentId, keyColumn, periodColumn)
                    .withFields(fields);
            return minConfidence == null ? config : config.withMinConfidence(minConfidence);
        }
    }

    public record TestRequest(Set<String> categories, Set<TestPriority> priorities) {
    }

    @PostMapping("/{namespace}/runs")
    public PipelineRun run(@PathVariable String namespace, @RequestBody(required = false) RunRequest request) {
        OrchestratorConfig defaults = this.orchestrator.defaultConfig();
        if (request == null) {
            return this.orchestrator.run(namespace, defaults);
        }
        OrchestratorConfig config = new OrchestratorConfig(
                request.maxIterations() != null ? request.maxIterations() : defaults.maxIterations(),
                request.targetAccuracy() != null ? request.targetAccuracy() : defaults.targetAccuracy(),
                Boolean.TRUE.equals(request.dryRun()),
                Boolean.TRUE.equals(request.skipGroundTruth()),
                request.maxActionsPerIteration() != null ? request.maxActionsPerIteration() : defaults.maxActionsPerIteration(),
                new TestRunOptions(request.categories(), request.priorities()));
        GroundTruthSource source = null;
        if (request.groundTruth() != null && request.groundTruth().sheet() != null) {
            source = new GroundTruthSource(request.groundTruth().sheet(), request.groundTruth().toConfig(namespace));
        }
        log.info("Starting pipeline run for {} (dryRun={})", namespace, config.dryRun());
        return this.orchestrator.run(namespace, request.documentId(), config, source);
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<PipelineRun> getRun(@PathVariable String runId) {
        return this.orchestrator.getRun(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{namespace}/runs")
    public List<PipelineRun> recentRuns(@PathVariable String namespace) {
        return this.orchestrator.recentRuns(namespace);
    }

    @PostMapping("/{namespace}/tests/run")
    public TestSuiteResult runTests(@PathVariable String namespace, @RequestBody(required = false) TestRequest request) {
        TestRunOptions options = request == null
                ? TestRunOptions.ALL : new TestRunOptions(request.categories(), request.priorities());
        return this.orchestrator.runAccuracyTests(namespace, options);
    }

    @PostMapping("/{namespace}/ground-truth")
    public List<GroundTruthRecord> extractGroundTruth(@PathVariable String namespace,
                                                      @RequestBody GroundTruthRequest request) {
        if (request.sheet() == null) {
            throw new IllegalArgumentException("sheet is required");
        }
        return this.groundTruthService.extractAndSave(request.sheet(), request.toConfig(namespace));
    }

    @GetMapping("/{namespace}/ground-truth")
    public List<GroundTruthRecord> groundTruth(@PathVariable String namespace) {
        return this.groundTruthService.getValidRecords(namespace);
    }

    @PostMapping("/{namespace}/tests")
    public List<AccuracyTestCase> generateTests(@PathVariable String namespace) {
        return this.groundTruthService.generateAndSaveTests(namespace);
    }

    @GetMapping("/{namespace}/actions")
    public List<OptimizationAction> activeActions(@PathVariable String namespace) {
        return this.optimizer.activeActions(namespace);
    }

    @PostMapping("/actions/{actionId}/rollback")
    public OptimizationAction rollback(@PathVariable String actionId) {
        return this.optimizer.rollback(actionId);
    }
}
