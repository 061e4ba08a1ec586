package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.DetectionConfig;
import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.engine.feature.FeatureProcessor;
import com.medwatch.anomaly.engine.rules.RuleEngine;
import com.medwatch.anomaly.engine.scoring.ScoringEnsemble;
import com.medwatch.anomaly.exception.AnomalyNotFoundException;
import com.medwatch.anomaly.exception.DataPointValidationException;
import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.AnomalyDetails;
import com.medwatch.anomaly.model.AnomalyStatus;
import com.medwatch.anomaly.model.BatchResult;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.DetectionMethod;
import com.medwatch.anomaly.model.DetectorStatistics;
import com.medwatch.anomaly.model.EnrichedDataPoint;
import com.medwatch.anomaly.model.Prediction;
import com.medwatch.anomaly.model.RuleMatch;
import com.medwatch.anomaly.model.Severity;
import com.medwatch.anomaly.model.ValidationResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the detection pipeline: pulls pending data points from every source, enriches them,
 * runs the rule engine and the scoring ensemble, records the resulting anomalies and forwards
 * confident ones to the alert channel.
 *
 * Pipeline per batch:
 *   1. Fetch up to batchSize points from each {@link DataPointSource}
 *   2. Validate and enrich (invalid points are skipped)
 *   3. Rules and ensemble per data point on the worker pool, results kept in input order
 *   4. Persist, remember and alert (confidence >= alertThreshold)
 *
 * Only one batch runs at a time; the scheduled cycle and manual triggers share a lock.
 */
@Service
public class DetectionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);
    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    private final FeatureProcessor featureProcessor;
    private final RuleEngine ruleEngine;
    private final ScoringEnsemble scoringEnsemble;
    private final List<DataPointSource> sources;
    private final DataPointSubmissionQueue submissionQueue;
    private final AnomalyStore anomalyStore;
    private final AnomalyAlertChannel alertChannel;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final ReentrantLock batchLock = new ReentrantLock();
    private final Object lifecycleLock = new Object();

    // Guarded by lifecycleLock
    private ScheduledFuture<?> cycle;
    private volatile boolean running;

    // Guarded by itself. Insertion order is detection order.
    private final LinkedHashMap<String, Anomaly> history = new LinkedHashMap<>();

    private final AtomicLong batchesProcessed = new AtomicLong();
    private final AtomicLong dataPointsProcessed = new AtomicLong();
    private volatile Long lastBatchAt;

    public DetectionOrchestrator(FeatureProcessor featureProcessor,
                                 RuleEngine ruleEngine,
                                 ScoringEnsemble scoringEnsemble,
                                 List<DataPointSource> sources,
                                 DataPointSubmissionQueue submissionQueue,
                                 AnomalyStore anomalyStore,
                                 AnomalyAlertChannel alertChannel,
                                 DetectionConfig config,
                                 MetricsConfig metricsConfig,
                                 Clock clock) {
        this.featureProcessor = featureProcessor;
        this.ruleEngine = ruleEngine;
        this.scoringEnsemble = scoringEnsemble;
        this.sources = sources;
        this.submissionQueue = submissionQueue;
        this.anomalyStore = anomalyStore;
        this.alertChannel = alertChannel;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "detection-scheduler");
            t.setDaemon(true);
            return t;
        });
        int threads = config.getWorkerThreads() > 0
                ? config.getWorkerThreads()
                : Runtime.getRuntime().availableProcessors();
        AtomicInteger workerIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "detection-worker-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        loadHistory();
        if (config.isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
        scheduler.shutdownNow();
        workers.shutdownNow();
    }

    /**
     * Start the periodic batch cycle.
     *
     * @return false if already running
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.info("Detection engine is already running");
                return false;
            }
            long intervalMs = config.getProcessingInterval().toMillis();
            cycle = scheduler.scheduleWithFixedDelay(this::runScheduledBatch,
                    intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            running = true;
            log.info("Detection engine started (interval={}ms, rules={}, models={})",
                    intervalMs, ruleEngine.getRuleCount(), scoringEnsemble.getModelCount());
            return true;
        }
    }

    /**
     * Cancel the periodic batch cycle. A batch already in progress completes.
     *
     * @return false if not running
     */
    public boolean stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return false;
            }
            cycle.cancel(false);
            cycle = null;
            running = false;
            log.info("Detection engine stopped");
            return true;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Queue a data point for the next batch. A full queue triggers a batch immediately.
     *
     * @return the id of the queued data point
     * @throws DataPointValidationException if the data point is invalid
     */
    public String submit(DataPoint dataPoint) {
        ValidationResult validation = featureProcessor.validate(dataPoint);
        if (!validation.isValid()) {
            throw new DataPointValidationException(dataPoint != null ? dataPoint.getId() : null,
                    validation.getErrors());
        }
        String id = submissionQueue.submit(dataPoint);
        if (submissionQueue.size() >= config.getBatchSize()) {
            log.info("Submission queue reached {} data points, triggering batch", submissionQueue.size());
            scheduler.execute(this::runScheduledBatch);
        }
        return id;
    }

    public ValidationResult validate(DataPoint dataPoint) {
        return featureProcessor.validate(dataPoint);
    }

    /**
     * Run one detection batch over everything the sources currently hold.
     */
    public BatchResult processBatch() {
        batchLock.lock();
        try {
            return runBatch();
        } finally {
            batchLock.unlock();
        }
    }

    private void runScheduledBatch() {
        try {
            processBatch();
        } catch (RuntimeException e) {
            log.error("Error processing detection batch: {}", e.getMessage(), e);
        }
    }

    private BatchResult runBatch() {
        long start = clock.millis();
        List<DataPoint> fetched = fetchPending();
        if (fetched.isEmpty()) {
            log.debug("No new data to process in this batch");
            return BatchResult.empty();
        }
        log.info("Processing batch of {} data points", fetched.size());

        List<EnrichedDataPoint> enriched = featureProcessor.preprocess(fetched);

        List<Future<List<Anomaly>>> futures = new ArrayList<>(enriched.size());
        for (EnrichedDataPoint dataPoint : enriched) {
            futures.add(workers.submit(() -> detect(dataPoint)));
        }

        List<Anomaly> detected = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                detected.addAll(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("Detection failed for data point {}: {}",
                        enriched.get(i).getId(), e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Batch interrupted after {} of {} data points", i, futures.size());
                break;
            }
        }

        int forwarded = 0;
        for (Anomaly anomaly : detected) {
            if (record(anomaly)) forwarded++;
        }

        long now = clock.millis();
        batchesProcessed.incrementAndGet();
        dataPointsProcessed.addAndGet(enriched.size());
        lastBatchAt = now;
        metricsConfig.recordBatch(fetched.size(), detected.size());

        log.info("Batch complete: fetched={}, processed={}, anomalies={}, alerts={}",
                fetched.size(), enriched.size(), detected.size(), forwarded);

        return BatchResult.builder()
                .fetched(fetched.size())
                .processed(enriched.size())
                .alertsForwarded(forwarded)
                .durationMs(now - start)
                .anomalies(detected)
                .build();
    }

    private List<DataPoint> fetchPending() {
        List<DataPoint> fetched = new ArrayList<>();
        for (DataPointSource source : sources) {
            try {
                List<DataPoint> pending = source.listPending(config.getBatchSize());
                if (!pending.isEmpty()) {
                    log.debug("Fetched {} data points from {}", pending.size(), source.getName());
                }
                fetched.addAll(pending);
            } catch (RuntimeException e) {
                log.error("Failed to fetch data points from {}: {}", source.getName(), e.getMessage(), e);
            }
        }
        return fetched;
    }

    List<Anomaly> detect(EnrichedDataPoint dataPoint) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (config.isRuleEngineEnabled()) {
            for (RuleMatch match : ruleEngine.evaluate(dataPoint)) {
                try {
                    anomalies.add(fromRuleMatch(match, dataPoint));
                } catch (RuntimeException e) {
                    log.error("Failed to build anomaly from rule {} for data point {}: {}",
                            match.getRuleId(), dataPoint.getId(), e.getMessage(), e);
                }
            }
        }
        if (config.isScoringEnabled()) {
            Prediction prediction = scoringEnsemble.predict(dataPoint);
            if (prediction.isAnomaly()) {
                anomalies.add(fromPrediction(prediction, dataPoint));
            }
        }
        return anomalies;
    }

    private Anomaly fromRuleMatch(RuleMatch match, EnrichedDataPoint enriched) {
        AnomalyDetails details = match.getAnomaly();
        Severity severity = details.getSeverity() != null ? details.getSeverity() : Severity.MEDIUM;
        return newAnomaly(enriched)
                .detectionMethod(DetectionMethod.RULE_BASED)
                .sourceIds(new ArrayList<>(List.of(match.getRuleId())))
                .type(details.getType())
                .severity(severity)
                .confidence(severity.ruleConfidence())
                .message(details.getMessage())
                .description(details.getDescription())
                .details(details.getDetails())
                .causes(details.getCauses())
                .build();
    }

    private Anomaly fromPrediction(Prediction prediction, EnrichedDataPoint enriched) {
        return newAnomaly(enriched)
                .detectionMethod(DetectionMethod.ML_BASED)
                .sourceIds(prediction.getContributingModels())
                .type(prediction.getType())
                .severity(prediction.getSeverity())
                .confidence(prediction.getConfidence())
                .message(prediction.getMessage())
                .details(prediction.getDetails())
                .causes(prediction.getCauses())
                .build();
    }

    private Anomaly.AnomalyBuilder newAnomaly(EnrichedDataPoint enriched) {
        DataPoint dp = enriched.getDataPoint();
        return Anomaly.builder()
                .id("ANOM-" + UUID.randomUUID())
                .dataPointId(dp.getId())
                .medicineName(dp.getMedicineName())
                .location(dp.getLocation())
                .dataPoint(dp)
                .status(AnomalyStatus.DETECTED)
                .detectedAt(clock.millis());
    }

    /**
     * Persist, remember and possibly alert on one anomaly.
     *
     * @return true if the anomaly was forwarded to the alert channel
     */
    private boolean record(Anomaly anomaly) {
        try {
            anomalyStore.save(anomaly);
        } catch (RuntimeException e) {
            log.error("Failed to persist anomaly {}: {}", anomaly.getId(), e.getMessage(), e);
        }
        remember(anomaly);
        metricsConfig.recordAnomaly(anomaly.getDetectionMethod().label(),
                anomaly.getSeverity().label(), anomaly.getConfidence());

        log.info("Anomaly detected [{}]: {} (severity={}, confidence={}, medicine={}, location={})",
                anomaly.getDetectionMethod().label(), anomaly.getType(), anomaly.getSeverity(),
                anomaly.getConfidence(), anomaly.getMedicineName(), anomaly.getLocation());

        if (anomaly.getConfidence() < config.getAlertThreshold()) {
            return false;
        }
        try {
            alertChannel.sendAlert(anomaly);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to raise alert for anomaly {}: {}", anomaly.getId(), e.getMessage(), e);
            return false;
        }
    }

    private void remember(Anomaly anomaly) {
        synchronized (history) {
            history.put(anomaly.getId(), anomaly);
            Iterator<String> oldest = history.keySet().iterator();
            while (history.size() > config.getHistoryLimit() && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        }
    }

    private void loadHistory() {
        try {
            List<Anomaly> stored = anomalyStore.list(config.getHistoryLimit());
            // Store returns newest first
            for (int i = stored.size() - 1; i >= 0; i--) {
                remember(stored.get(i));
            }
            if (!stored.isEmpty()) {
                log.info("Loaded {} anomalies from store", stored.size());
            }
        } catch (RuntimeException e) {
            log.warn("Could not load anomaly history from store: {}", e.getMessage());
        }
    }

    /**
     * Record a review decision for an anomaly.
     *
     * @throws AnomalyNotFoundException if the id is unknown
     */
    public Anomaly updateAnomalyStatus(String anomalyId, AnomalyStatus status, String reviewedBy) {
        Anomaly anomaly = getAnomaly(anomalyId);
        synchronized (anomaly) {
            anomaly.setStatus(status);
            anomaly.setReviewedBy(reviewedBy);
            anomaly.setReviewedAt(clock.millis());
        }
        try {
            anomalyStore.updateStatus(anomaly);
        } catch (RuntimeException e) {
            log.error("Failed to persist status of anomaly {}: {}", anomalyId, e.getMessage(), e);
        }
        log.info("Anomaly {} marked {} by {}", anomalyId, status.label(), reviewedBy);
        return anomaly;
    }

    /**
     * @throws AnomalyNotFoundException if the id is unknown
     */
    public Anomaly getAnomaly(String anomalyId) {
        synchronized (history) {
            Anomaly anomaly = history.get(anomalyId);
            if (anomaly != null) {
                return anomaly;
            }
        }
        // Evicted from memory, fall back to the store
        Optional<Anomaly> stored;
        try {
            stored = anomalyStore.findById(anomalyId);
        } catch (RuntimeException e) {
            log.warn("Could not look up anomaly {} in store: {}", anomalyId, e.getMessage());
            stored = Optional.empty();
        }
        return stored.orElseThrow(() -> new AnomalyNotFoundException(anomalyId));
    }

    /**
     * Most recent anomalies first, optionally filtered. Null filters match everything.
     */
    public List<Anomaly> getRecentAnomalies(int limit, Severity severity, String type, AnomalyStatus status) {
        List<Anomaly> all = snapshot();
        Collections.reverse(all);
        List<Anomaly> result = new ArrayList<>();
        for (Anomaly anomaly : all) {
            if (result.size() >= limit) break;
            if (severity != null && severity != anomaly.getSeverity()) continue;
            if (type != null && !type.equalsIgnoreCase(anomaly.getType())) continue;
            if (status != null && status != anomaly.getStatus()) continue;
            result.add(anomaly);
        }
        return result;
    }

    public DetectorStatistics getStatistics() {
        List<Anomaly> all = snapshot();
        long cutoff = clock.millis() - DAY_MS;

        long last24Hours = 0;
        double confidenceSum = 0.0;
        Map<String, Long> byType = new TreeMap<>();
        Map<String, Long> byMethod = new TreeMap<>();
        Map<String, Long> bySeverity = new TreeMap<>();
        Map<String, Long> byStatus = new TreeMap<>();

        for (Anomaly anomaly : all) {
            if (anomaly.getDetectedAt() >= cutoff) last24Hours++;
            confidenceSum += anomaly.getConfidence();
            byType.merge(String.valueOf(anomaly.getType()), 1L, Long::sum);
            byMethod.merge(anomaly.getDetectionMethod().label(), 1L, Long::sum);
            bySeverity.merge(anomaly.getSeverity().label(), 1L, Long::sum);
            byStatus.merge(anomaly.getStatus().label(), 1L, Long::sum);
        }

        return DetectorStatistics.builder()
                .running(running)
                .totalAnomalies(all.size())
                .last24Hours(last24Hours)
                .byType(byType)
                .byDetectionMethod(byMethod)
                .bySeverity(bySeverity)
                .byStatus(byStatus)
                .averageConfidence(all.isEmpty() ? 0.0 : confidenceSum / all.size())
                .queueSize(submissionQueue.size())
                .batchesProcessed(batchesProcessed.get())
                .dataPointsProcessed(dataPointsProcessed.get())
                .lastBatchAt(lastBatchAt)
                .build();
    }

    private List<Anomaly> snapshot() {
        synchronized (history) {
            return new ArrayList<>(history.values());
        }
    }
}
