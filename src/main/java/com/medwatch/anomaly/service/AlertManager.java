package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.AlertConfig;
import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.exception.AlertNotFoundException;
import com.medwatch.anomaly.model.Alert;
import com.medwatch.anomaly.model.AlertRule;
import com.medwatch.anomaly.model.AlertStatistics;
import com.medwatch.anomaly.model.AlertStatus;
import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.NotificationResult;
import com.medwatch.anomaly.model.Severity;
import com.medwatch.anomaly.notification.NotificationChannel;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns anomalies into alerts and delivers them through the notification channels named by
 * the alert rule of their severity.
 *
 * Alert lifecycle:
 *   pending -> processing -> sent | failed
 *   failed  -> processing              (retry, while attempts &lt; maxAttempts)
 *   sent    -> escalated               (escalation timeout elapsed without acknowledgement)
 *   any     -> acknowledged            (cancels pending retry and escalation)
 *
 * Immediate rules are delivered on the calling thread. Other alerts wait in a queue that is
 * drained once per debounce period; batching alerts sharing severity and batching interval
 * are then delivered together as a single batch alert.
 */
@Service
public class AlertManager implements AnomalyAlertChannel {

    private static final Logger log = LoggerFactory.getLogger(AlertManager.class);
    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();
    private final AlertConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService notificationExecutor;

    // Guarded by itself. Insertion order is creation order.
    private final LinkedHashMap<String, Alert> alerts = new LinkedHashMap<>();

    private final Map<String, ScheduledFuture<?>> retryTasks = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> escalationTasks = new ConcurrentHashMap<>();
    private final Map<String, List<Alert>> batchMemberAlerts = new ConcurrentHashMap<>();

    private final Object queueLock = new Object();
    // Guarded by queueLock
    private final List<Alert> queue = new ArrayList<>();
    private ScheduledFuture<?> drainTask;

    public AlertManager(List<NotificationChannel> notificationChannels, AlertConfig config,
                        MetricsConfig metricsConfig, Clock clock) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        for (NotificationChannel channel : notificationChannels) {
            channels.put(channel.getName(), channel);
        }

        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "alert-scheduler");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger index = new AtomicInteger();
        this.notificationExecutor = Executors.newFixedThreadPool(config.getNotificationThreads(), r -> {
            Thread t = new Thread(r, "alert-notify-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("Alert manager initialized with channels {} and rules for {}",
                channels.keySet(), config.getRules().keySet());
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        notificationExecutor.shutdownNow();
    }

    /**
     * Create an alert for an anomaly. The anomaly's own severity is used when present,
     * otherwise it is derived from the confidence.
     *
     * @return the alert id, or empty when no alert rule covers the severity
     */
    @Override
    @Observed(name = "alerts.send", contextualName = "send-alert")
    public Optional<String> sendAlert(Anomaly anomaly) {
        Severity severity = anomaly.getSeverity() != null
                ? anomaly.getSeverity()
                : Severity.fromConfidence(anomaly.getConfidence());
        AlertRule rule = config.getRules().get(severity);
        if (rule == null) {
            log.warn("No alert rule for severity {}, anomaly {} not alerted", severity.label(), anomaly.getId());
            return Optional.empty();
        }

        Alert alert = Alert.builder()
                .id("ALERT-" + UUID.randomUUID())
                .anomaly(anomaly)
                .severity(severity)
                .rule(rule)
                .maxAttempts(config.getMaxAttempts())
                .createdAt(clock.millis())
                .build();
        register(alert);
        log.info("Alert {} created for anomaly {} (severity={}, immediate={})",
                alert.getId(), anomaly.getId(), severity.label(), rule.isImmediate());

        if (rule.isImmediate()) {
            processAlert(alert);
        } else {
            enqueue(alert);
        }
        return Optional.of(alert.getId());
    }

    /**
     * Deliver an alert to every enabled channel of its rule in parallel and settle its status.
     * Acknowledged alerts are left untouched.
     */
    void processAlert(Alert alert) {
        cancel(retryTasks, alert.getId());
        AlertRule rule;
        synchronized (alert) {
            if (alert.getStatus() == AlertStatus.ACKNOWLEDGED) {
                log.debug("Alert {} already acknowledged, skipping delivery", alert.getId());
                return;
            }
            alert.setStatus(AlertStatus.PROCESSING);
            alert.setAttempts(alert.getAttempts() + 1);
            rule = alert.getRule();
        }
        metricsConfig.recordAlertTransition(AlertStatus.PROCESSING.label());

        List<NotificationResult> results = deliver(alert, rule.getChannels(), rule, false);
        boolean delivered = results.stream().anyMatch(NotificationResult::isSuccess);

        AlertStatus outcome;
        int attempts;
        synchronized (alert) {
            alert.getNotifications().addAll(results);
            alert.setProcessedAt(clock.millis());
            if (alert.getStatus() == AlertStatus.ACKNOWLEDGED) {
                return;
            }
            if (delivered) {
                alert.setStatus(AlertStatus.SENT);
                alert.setError(null);
            } else {
                alert.setStatus(AlertStatus.FAILED);
                alert.setError(results.isEmpty() ? "No enabled channel" : "All channels failed");
            }
            outcome = alert.getStatus();
            attempts = alert.getAttempts();
        }
        metricsConfig.recordAlertTransition(outcome.label());

        if (outcome == AlertStatus.SENT) {
            log.info("Alert {} sent via {}", alert.getId(), successfulChannels(results));
            if (rule.getEscalation() != null && rule.getEscalation().isEnabled()) {
                scheduleEscalation(alert, rule.getEscalation().getTimeout());
            }
        } else if (attempts < alert.getMaxAttempts()) {
            Duration delay = config.getRetryDelay().multipliedBy(attempts);
            log.warn("Alert {} failed (attempt {}/{}), retrying in {}ms",
                    alert.getId(), attempts, alert.getMaxAttempts(), delay.toMillis());
            scheduleRetry(alert, delay);
        } else {
            log.error("Alert {} failed after {} attempts", alert.getId(), attempts);
        }

        if (alert.isBatch()) {
            settleBatchMembers(alert, outcome);
        }
    }

    private List<NotificationResult> deliver(Alert alert, List<String> channelNames, AlertRule rule, boolean escalation) {
        List<CompletableFuture<NotificationResult>> futures = new ArrayList<>();
        for (String name : channelNames) {
            NotificationChannel channel = channels.get(name);
            if (channel == null) {
                log.warn("Notification channel {} not found, skipping for alert {}", name, alert.getId());
                continue;
            }
            if (!channel.isEnabled()) {
                log.warn("Notification channel {} is disabled, skipping for alert {}", name, alert.getId());
                continue;
            }
            List<String> recipients = rule.recipientsFor(name);
            futures.add(CompletableFuture.supplyAsync(
                    () -> sendVia(channel, alert, recipients, escalation), notificationExecutor));
        }

        List<NotificationResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<NotificationResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private NotificationResult sendVia(NotificationChannel channel, Alert alert, List<String> recipients,
                                       boolean escalation) {
        NotificationResult result;
        try {
            result = channel.send(alert, recipients, escalation);
        } catch (RuntimeException e) {
            log.error("Failed to send alert {} via {}: {}", alert.getId(), channel.getName(), e.getMessage(), e);
            result = NotificationResult.failure(channel.getName(), e.getMessage());
            result.setEscalation(escalation);
        }
        metricsConfig.recordNotification(channel.getName(), result.isSuccess() ? "success" : "error");
        return result;
    }

    private void scheduleRetry(Alert alert, Duration delay) {
        ScheduledFuture<?> task = scheduler.schedule(() -> {
            retryTasks.remove(alert.getId());
            try {
                processAlert(alert);
            } catch (RuntimeException e) {
                log.error("Retry of alert {} failed: {}", alert.getId(), e.getMessage(), e);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        replace(retryTasks, alert.getId(), task);
    }

    private void scheduleEscalation(Alert alert, Duration timeout) {
        ScheduledFuture<?> task = scheduler.schedule(() -> {
            escalationTasks.remove(alert.getId());
            try {
                escalate(alert);
            } catch (RuntimeException e) {
                log.error("Escalation of alert {} failed: {}", alert.getId(), e.getMessage(), e);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        replace(escalationTasks, alert.getId(), task);
    }

    /**
     * Deliver an unacknowledged sent alert to the rule's escalation channels.
     */
    void escalate(Alert alert) {
        AlertRule rule;
        synchronized (alert) {
            if (alert.getStatus() != AlertStatus.SENT) {
                log.debug("Alert {} is {}, not escalating", alert.getId(), alert.getStatus().label());
                return;
            }
            rule = alert.getRule();
        }
        log.warn("Escalating unacknowledged alert {} to {}", alert.getId(), rule.getEscalation().getEscalateToChannels());

        List<NotificationResult> results = deliver(alert, rule.getEscalation().getEscalateToChannels(), rule, true);
        synchronized (alert) {
            alert.getNotifications().addAll(results);
            if (alert.getStatus() == AlertStatus.ACKNOWLEDGED) {
                return;
            }
            alert.setStatus(AlertStatus.ESCALATED);
            alert.setEscalatedAt(clock.millis());
        }
        metricsConfig.recordAlertTransition(AlertStatus.ESCALATED.label());
    }

    /**
     * Mark an alert acknowledged, cancelling any pending retry or escalation.
     *
     * @throws AlertNotFoundException if the id is unknown
     */
    public Alert acknowledgeAlert(String alertId, String acknowledgedBy) {
        Alert alert = getAlert(alertId);
        cancel(retryTasks, alertId);
        cancel(escalationTasks, alertId);
        synchronized (alert) {
            alert.setStatus(AlertStatus.ACKNOWLEDGED);
            alert.setAcknowledgedAt(clock.millis());
            alert.setAcknowledgedBy(acknowledgedBy);
        }
        metricsConfig.recordAlertTransition(AlertStatus.ACKNOWLEDGED.label());
        log.info("Alert {} acknowledged by {}", alertId, acknowledgedBy);
        return alert;
    }

    private void enqueue(Alert alert) {
        int depth;
        synchronized (queueLock) {
            queue.add(alert);
            depth = queue.size();
            if (drainTask == null) {
                drainTask = scheduler.schedule(this::drainQueueSafely,
                        config.getQueueDebounce().toMillis(), TimeUnit.MILLISECONDS);
            }
        }
        metricsConfig.updateAlertQueueDepth(depth);
    }

    private void drainQueueSafely() {
        try {
            drainQueue();
        } catch (RuntimeException e) {
            log.error("Error draining alert queue: {}", e.getMessage(), e);
        }
    }

    /**
     * Deliver everything queued so far. Batching alerts are grouped by severity and batching
     * interval; a group of one is delivered on its own.
     */
    void drainQueue() {
        List<Alert> pending;
        synchronized (queueLock) {
            pending = new ArrayList<>(queue);
            queue.clear();
            drainTask = null;
        }
        metricsConfig.updateAlertQueueDepth(0);
        if (pending.isEmpty()) return;

        Map<String, List<Alert>> groups = new LinkedHashMap<>();
        for (Alert alert : pending) {
            AlertRule rule = alert.getRule();
            if (rule.isBatchingEnabled()) {
                String key = alert.getSeverity().label() + ":" + rule.getBatchingInterval();
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(alert);
            } else {
                processAlert(alert);
            }
        }

        for (List<Alert> group : groups.values()) {
            if (group.size() == 1) {
                processAlert(group.get(0));
            } else {
                processAlert(createBatch(group));
            }
        }
    }

    private Alert createBatch(List<Alert> members) {
        Alert first = members.get(0);
        List<Anomaly> anomalies = new ArrayList<>();
        for (Alert member : members) {
            anomalies.add(member.getAnomaly());
        }
        Alert batch = Alert.builder()
                .id("BATCH-" + UUID.randomUUID())
                .batch(true)
                .batchMembers(anomalies)
                .severity(first.getSeverity())
                .rule(first.getRule())
                .maxAttempts(config.getMaxAttempts())
                .createdAt(clock.millis())
                .build();

        for (Alert member : members) {
            synchronized (member) {
                member.setBatchId(batch.getId());
            }
        }
        batchMemberAlerts.put(batch.getId(), members);
        register(batch);
        log.info("Batch alert {} created for {} {} alerts", batch.getId(), members.size(), first.getSeverity().label());
        return batch;
    }

    private void settleBatchMembers(Alert batch, AlertStatus outcome) {
        List<Alert> members = batchMemberAlerts.get(batch.getId());
        if (members == null) return;
        long now = clock.millis();
        for (Alert member : members) {
            synchronized (member) {
                if (member.getStatus() == AlertStatus.ACKNOWLEDGED) continue;
                member.setStatus(outcome);
                member.setAttempts(batch.getAttempts());
                member.setProcessedAt(now);
            }
        }
    }

    /**
     * @throws AlertNotFoundException if the id is unknown
     */
    public Alert getAlert(String alertId) {
        synchronized (alerts) {
            Alert alert = alerts.get(alertId);
            if (alert == null) {
                throw new AlertNotFoundException(alertId);
            }
            return alert;
        }
    }

    /**
     * Most recent alerts first.
     */
    public List<Alert> getRecentAlerts(int limit) {
        List<Alert> all = snapshot();
        Collections.reverse(all);
        return all.size() > limit ? new ArrayList<>(all.subList(0, limit)) : all;
    }

    public AlertStatistics getAlertStats() {
        List<Alert> all = snapshot();
        long cutoff = clock.millis() - DAY_MS;

        long last24Hours = 0;
        long processed = 0;
        long responseSum = 0;
        Map<String, Long> bySeverity = new TreeMap<>();
        Map<String, Long> byStatus = new TreeMap<>();

        for (Alert alert : all) {
            synchronized (alert) {
                if (alert.getCreatedAt() >= cutoff) last24Hours++;
                bySeverity.merge(alert.getSeverity().label(), 1L, Long::sum);
                byStatus.merge(alert.getStatus().label(), 1L, Long::sum);
                if (alert.getProcessedAt() != null) {
                    processed++;
                    responseSum += alert.getProcessedAt() - alert.getCreatedAt();
                }
            }
        }

        return AlertStatistics.builder()
                .total(all.size())
                .last24Hours(last24Hours)
                .bySeverity(bySeverity)
                .byStatus(byStatus)
                .averageResponseTimeMs(processed > 0 ? (double) responseSum / processed : 0.0)
                .queueSize(getQueueSize())
                .build();
    }

    public int getQueueSize() {
        synchronized (queueLock) {
            return queue.size();
        }
    }

    boolean hasScheduledRetry(String alertId) {
        return retryTasks.containsKey(alertId);
    }

    boolean hasScheduledEscalation(String alertId) {
        return escalationTasks.containsKey(alertId);
    }

    private void register(Alert alert) {
        synchronized (alerts) {
            alerts.put(alert.getId(), alert);
        }
        metricsConfig.recordAlertTransition(AlertStatus.PENDING.label());
    }

    private List<Alert> snapshot() {
        synchronized (alerts) {
            return new ArrayList<>(alerts.values());
        }
    }

    private static List<String> successfulChannels(List<NotificationResult> results) {
        List<String> names = new ArrayList<>();
        for (NotificationResult result : results) {
            if (result.isSuccess()) names.add(result.getChannel());
        }
        return names;
    }

    private static void replace(Map<String, ScheduledFuture<?>> tasks, String alertId, ScheduledFuture<?> task) {
        ScheduledFuture<?> previous = tasks.put(alertId, task);
        if (previous != null) previous.cancel(false);
    }

    private static void cancel(Map<String, ScheduledFuture<?>> tasks, String alertId) {
        ScheduledFuture<?> task = tasks.remove(alertId);
        if (task != null) task.cancel(false);
    }
}
