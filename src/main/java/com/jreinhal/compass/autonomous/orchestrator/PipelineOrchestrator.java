package com.jreinhal.compass.autonomous.orchestrator;

import com.jreinhal.compass.autonomous.accuracy.AccuracyTester;
import com.jreinhal.compass.autonomous.accuracy.ApplyOutcome;
import com.jreinhal.compass.autonomous.accuracy.FailureAnalysis;
import com.jreinhal.compass.autonomous.accuracy.FailureAnalyzer;
import com.jreinhal.compass.autonomous.accuracy.OptimizationContext;
import com.jreinhal.compass.autonomous.accuracy.OptimizationSuggestion;
import com.jreinhal.compass.autonomous.accuracy.SchemaOptimizer;
import com.jreinhal.compass.autonomous.accuracy.TestRunOptions;
import com.jreinhal.compass.autonomous.accuracy.TestSuiteResult;
import com.jreinhal.compass.autonomous.groundtruth.GroundTruthService;
import com.jreinhal.compass.exception.SchemaDiscoveryException;
import com.jreinhal.compass.model.OptimizationAction;
import com.jreinhal.compass.model.PipelinePhase;
import com.jreinhal.compass.model.PipelineRun;
import com.jreinhal.compass.pipeline.NamespacePipelineState;
import com.jreinhal.compass.pipeline.SchemaCacheCoordinator;
import com.jreinhal.compass.pipeline.UpdateReason;
import com.jreinhal.compass.repository.OptimizationActionRepository;
import com.jreinhal.compass.repository.PipelineRunRepository;
import com.jreinhal.compass.vector.NamespaceStats;
import com.jreinhal.compass.vector.NamespaceVectorStore;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Drives the improvement loop for one namespace: analyze, regenerate the schema, extract
 * ground truth, then alternate testing and optimization until the target accuracy is reached
 * or the iteration budget runs out.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final NamespaceVectorStore vectorStore;
    private final SchemaCacheCoordinator coordinator;
    private final GroundTruthService groundTruthService;
    private final AccuracyTester accuracyTester;
    private final FailureAnalyzer failureAnalyzer;
    private final SchemaOptimizer optimizer;
    private final PipelineRunRepository runRepository;
    private final OptimizationActionRepository actionRepository;
    private final Clock clock;

    @Value("${compass.autonomous.max-iterations:5}")
    private int maxIterations = 5;
    @Value("${compass.autonomous.target-accuracy:0.95}")
    private double targetAccuracy = 0.95;
    @Value("${compass.autonomous.max-actions-per-iteration:3}")
    private int maxActionsPerIteration = 3;
    @Value("${compass.autonomous.discovery-timeout-ms:120000}")
    private long discoveryTimeoutMs = 120000L;

    public PipelineOrchestrator(NamespaceVectorStore vectorStore, SchemaCacheCoordinator coordinator,
                                GroundTruthService groundTruthService, AccuracyTester accuracyTester,
                                FailureAnalyzer failureAnalyzer, SchemaOptimizer optimizer,
                                PipelineRunRepository runRepository, OptimizationActionRepository actionRepository,
                                Clock clock) {
        this.vectorStore = vectorStore;
        this.coordinator = coordinator;
        this.groundTruthService = groundTruthService;
        this.accuracyTester = accuracyTester;
        this.failureAnalyzer = failureAnalyzer;
        this.optimizer = optimizer;
        this.runRepository = runRepository;
        this.actionRepository = actionRepository;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        log.info("Pipeline orchestrator initialized (maxIterations={}, targetAccuracy={}, maxActionsPerIteration={})",
                this.maxIterations, this.targetAccuracy, this.maxActionsPerIteration);
    }

    public OrchestratorConfig defaultConfig() {
        return new OrchestratorConfig(this.maxIterations, this.targetAccuracy, false, false,
                this.maxActionsPerIteration, TestRunOptions.ALL);
    }

    public PipelineRun run(String namespace, OrchestratorConfig config) {
        return run(namespace, null, config, null);
    }

    /**
     * Runs the full loop. Never throws for pipeline failures; the returned run carries
     * {@code FAILED} and the captured message instead.
     *
     * @param source ground truth to extract before testing, or null to test against the
     *               records already stored
     */
    public PipelineRun run(String namespace, String documentId, OrchestratorConfig config, GroundTruthSource source) {
        OrchestratorConfig settings = config == null ? defaultConfig() : config;
        PipelineRun run = new PipelineRun(namespace, documentId, Instant.now(this.clock));
        run.setStatus(PipelineRun.RunStatus.RUNNING);
        run = this.runRepository.save(run);
        log.info("Pipeline run {} started for {} (target {}, max {} iterations, dryRun {})",
                run.getId(), namespace, settings.targetAccuracy(), settings.maxIterations(), settings.dryRun());
        try {
            enterPhase(run, PipelinePhase.ANALYZING);
            NamespaceStats stats = this.vectorStore.getNamespaceStats(namespace);
            if (stats.vectorCount() == 0L) {
                throw new IllegalStateException("Namespace " + namespace + " has no vectors");
            }

            enterPhase(run, PipelinePhase.DISCOVERING_SCHEMA);
            regenerateSchema(namespace, documentId);

            if (!settings.skipGroundTruth()) {
                enterPhase(run, PipelinePhase.GROUND_TRUTH);
                if (source != null) {
                    this.groundTruthService.extractAndSave(source.sheet(), source.extraction());
                }
                this.groundTruthService.generateAndSaveTests(namespace);
            }

            improve(run, namespace, settings);

            run.setPhase(PipelinePhase.COMPLETED);
            run.setStatus(PipelineRun.RunStatus.COMPLETED);
            log.info("Pipeline run {} completed for {} after {} iteration(s), accuracy history {}",
                    run.getId(), namespace, run.getIteration(), run.getAccuracyHistory());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            run.setPhase(PipelinePhase.FAILED);
            run.setStatus(PipelineRun.RunStatus.FAILED);
            run.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.error("Pipeline run {} failed for {}", run.getId(), namespace, e);
        }
        run.setCompletedAt(Instant.now(this.clock));
        return this.runRepository.save(run);
    }

    /**
     * Runs the test suite once without optimizing.
     */
    public TestSuiteResult runAccuracyTests(String namespace, TestRunOptions options) {
        return this.accuracyTester.runTestSuite(namespace, options);
    }

    public Optional<PipelineRun> getRun(String runId) {
        return this.runRepository.findById(runId);
    }

    public List<PipelineRun> recentRuns(String namespace) {
        return this.runRepository.findTop10BySchemaIdOrderByStartedAtDesc(namespace);
    }

    private void improve(PipelineRun run, String namespace, OrchestratorConfig settings) {
        List<OptimizationAction> awaitingResult = new ArrayList<>();
        for (int iteration = 0; iteration < settings.maxIterations(); iteration++) {
            run.setIteration(iteration + 1);
            enterPhase(run, PipelinePhase.TESTING);
            TestSuiteResult suite = this.accuracyTester.runTestSuite(namespace, settings.testOptions());
            run.recordAccuracy(suite.accuracy());
            run.setTestsRun(suite.testsRun());
            run.setTestsPassed(suite.testsPassed());
            recordAccuracyAfter(awaitingResult, suite.accuracy());
            awaitingResult.clear();

            if (suite.testsRun() == 0) {
                log.info("Run {}: no tests to run for {}, stopping", run.getId(), namespace);
                return;
            }
            if (suite.accuracy() >= settings.targetAccuracy()) {
                log.info("Run {}: target accuracy reached ({} >= {})", run.getId(), suite.accuracy(), settings.targetAccuracy());
                return;
            }
            if (iteration == settings.maxIterations() - 1) {
                log.info("Run {}: iteration budget spent at accuracy {}", run.getId(), suite.accuracy());
                return;
            }

            enterPhase(run, PipelinePhase.OPTIMIZING);
            FailureAnalysis analysis = this.failureAnalyzer.analyze(suite.results());
            analysis.criticalIssues().forEach(issue -> log.warn("Run {}: {}", run.getId(), issue));
            List<OptimizationSuggestion> selected = analysis.suggestions().stream()
                    .limit(settings.maxActionsPerIteration())
                    .toList();
            if (selected.isEmpty()) {
                log.info("Run {}: no optimization suggestions, stopping at accuracy {}", run.getId(), suite.accuracy());
                return;
            }

            OptimizationContext context = new OptimizationContext(namespace, run.getId(), iteration,
                    suite.accuracy(), settings.dryRun());
            for (OptimizationSuggestion suggestion : selected) {
                ApplyOutcome outcome = this.optimizer.apply(suggestion, context);
                if (outcome.applied()) {
                    run.getAppliedActions().add(outcome.actionId());
                    this.actionRepository.findById(outcome.actionId()).ifPresent(awaitingResult::add);
                } else {
                    run.getProposedActions().add(outcome.actionId());
                }
            }
            this.runRepository.save(run);
            if (settings.dryRun()) {
                log.info("Run {}: dry run recorded {} proposed action(s)", run.getId(), selected.size());
                return;
            }
            if (awaitingResult.isEmpty()) {
                log.info("Run {}: no optimization could be applied, stopping", run.getId());
                return;
            }
            if (!this.coordinator.waitForUpdate(namespace)) {
                log.warn("Run {}: schema of {} did not settle after optimization, stopping at accuracy {}",
                        run.getId(), namespace, suite.accuracy());
                return;
            }
        }
    }

    private void recordAccuracyAfter(List<OptimizationAction> actions, double accuracy) {
        for (OptimizationAction action : actions) {
            action.setAccuracyAfter(accuracy);
            this.actionRepository.save(action);
            if (action.regressed()) {
                log.warn("Optimization {} ({}) lowered accuracy from {} to {}; it remains eligible for rollback",
                        action.getId(), action.getActionType().id(), action.getAccuracyBefore(), accuracy);
            }
        }
    }

    private void regenerateSchema(String namespace, String documentId) throws InterruptedException {
        boolean success;
        try {
            success = this.coordinator.requestUpdate(namespace, UpdateReason.MANUAL_REFRESH, documentId)
                    .get(this.discoveryTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            throw new SchemaDiscoveryException(namespace, "Schema regeneration did not finish: " + e.getMessage(), e);
        }
        if (!success) {
            String reason = this.coordinator.getState(namespace)
                    .map(NamespacePipelineState::error)
                    .orElse(null);
            throw new SchemaDiscoveryException(namespace,
                    reason != null ? reason : "Schema regeneration failed for " + namespace, null);
        }
    }

    private void enterPhase(PipelineRun run, PipelinePhase phase) {
        run.setPhase(phase);
        this.runRepository.save(run);
        log.info("Run {} entering phase {}", run.getId(), phase.id());
    }
}
