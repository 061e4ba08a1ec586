package com.medwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.config.AerospikeConfig;
import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.service.AnomalyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
public class AnomalyRepository implements AnomalyStore {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnomalyRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void save(Anomaly anomaly) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomaly.getId());

        Bin idBin = new Bin("anomalyId", anomaly.getId());
        Bin methodBin = new Bin("method", anomaly.getDetectionMethod().label());
        Bin typeBin = new Bin("type", anomaly.getType());
        Bin severityBin = new Bin("severity", anomaly.getSeverity().label());
        Bin confidenceBin = new Bin("confidence", anomaly.getConfidence());
        Bin medicineBin = new Bin("medicine", anomaly.getMedicineName());
        Bin locationBin = new Bin("location", anomaly.getLocation());
        Bin detectedAtBin = new Bin("detectedAt", anomaly.getDetectedAt());
        Bin payloadBin = new Bin("payload", serialize(anomaly));

        client.put(writePolicy, key,
                idBin, methodBin, typeBin, severityBin, confidenceBin,
                medicineBin, locationBin, detectedAtBin, statusBin(anomaly), payloadBin);
    }

    @Override
    public void updateStatus(Anomaly anomaly) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomaly.getId());
        Bin reviewedByBin = new Bin("reviewedBy", anomaly.getReviewedBy() != null ? anomaly.getReviewedBy() : "");
        Bin reviewedAtBin = new Bin("reviewedAt", anomaly.getReviewedAt() != null ? anomaly.getReviewedAt() : 0L);
        client.put(writePolicy, key, statusBin(anomaly), reviewedByBin, reviewedAtBin,
                new Bin("payload", serialize(anomaly)));
    }

    @Override
    public Optional<Anomaly> findById(String anomalyId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);
        Record record = client.get(readPolicy, key);
        if (record == null) return Optional.empty();
        return Optional.ofNullable(deserialize(record.getString("payload")));
    }

    @Override
    public List<Anomaly> list(int limit) {
        List<Anomaly> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    Anomaly anomaly = deserialize(record.getString("payload"));
                    if (anomaly != null) {
                        synchronized (results) {
                            results.add(anomaly);
                        }
                    }
                });

        results.sort(Comparator.comparingLong(Anomaly::getDetectedAt).reversed());
        if (results.size() > limit) {
            return new ArrayList<>(results.subList(0, limit));
        }
        return results;
    }

    private static Bin statusBin(Anomaly anomaly) {
        return new Bin("status", anomaly.getStatus().label());
    }

    private String serialize(Anomaly anomaly) {
        try {
            return objectMapper.writeValueAsString(anomaly);
        } catch (Exception e) {
            log.error("Failed to serialize anomaly {}", anomaly.getId(), e);
            return "{}";
        }
    }

    private Anomaly deserialize(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, Anomaly.class);
        } catch (Exception e) {
            log.error("Failed to deserialize anomaly", e);
            return null;
        }
    }
}
