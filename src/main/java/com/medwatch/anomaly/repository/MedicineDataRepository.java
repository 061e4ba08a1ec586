package com.medwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.config.AerospikeConfig;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.service.DataPointSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pending medicine data points in the {@code medicine_data} set.
 *
 * Bins: payload (DataPoint JSON), status (pending | processed | invalid), receivedAt, processedAt.
 * Records are written by the ingestion side with status "pending"; fetching marks them processed.
 */
@Repository
@ConditionalOnProperty(prefix = "medwatch.detection", name = "store-source-enabled", havingValue = "true",
        matchIfMissing = true)
public class MedicineDataRepository implements DataPointSource {

    private static final Logger log = LoggerFactory.getLogger(MedicineDataRepository.class);

    static final String STATUS_PENDING = "pending";
    static final String STATUS_PROCESSED = "processed";
    static final String STATUS_INVALID = "invalid";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MedicineDataRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  Clock clock) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String getName() {
        return "aerospike:" + AerospikeConfig.SET_MEDICINE_DATA;
    }

    /**
     * Oldest pending records first, up to {@code limit}. Every returned record is marked processed.
     */
    @Override
    public List<DataPoint> listPending(int limit) {
        List<PendingRecord> pending = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MEDICINE_DATA,
                (key, record) -> {
                    if (STATUS_PENDING.equals(record.getString("status"))) {
                        synchronized (pending) {
                            pending.add(new PendingRecord(key, record));
                        }
                    }
                });

        pending.sort(Comparator.comparingLong(p -> p.record.getLong("receivedAt")));

        List<DataPoint> dataPoints = new ArrayList<>();
        for (PendingRecord p : pending) {
            if (dataPoints.size() >= limit) break;
            DataPoint dataPoint = parse(p);
            if (dataPoint == null) {
                markStatus(p.key, STATUS_INVALID);
                continue;
            }
            dataPoints.add(dataPoint);
            markStatus(p.key, STATUS_PROCESSED);
        }
        return dataPoints;
    }

    private DataPoint parse(PendingRecord p) {
        String json = p.record.getString("payload");
        if (json == null || json.isEmpty()) {
            log.warn("Medicine data record {} has no payload", p.key);
            return null;
        }
        try {
            DataPoint dataPoint = objectMapper.readValue(json, DataPoint.class);
            if (dataPoint.getId() == null && p.key.userKey != null) {
                dataPoint = dataPoint.toBuilder().id(p.key.userKey.toString()).build();
            }
            return dataPoint;
        } catch (Exception e) {
            log.error("Failed to deserialize medicine data record {}", p.key, e);
            return null;
        }
    }

    private void markStatus(Key key, String status) {
        client.put(writePolicy, key,
                new Bin("status", status),
                new Bin("processedAt", clock.millis()));
    }

    private static final class PendingRecord {
        final Key key;
        final Record record;

        PendingRecord(Key key, Record record) {
            this.key = key;
            this.record = record;
        }
    }
}
