package com.medwatch.anomaly.service;

import com.medwatch.anomaly.model.DataPoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory source fed by the REST submission endpoint.
 */
@Component
public class DataPointSubmissionQueue implements DataPointSource {

    private final Queue<DataPoint> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger();

    @Override
    public String getName() {
        return "submissions";
    }

    /**
     * Enqueue a data point, assigning an id when it has none.
     *
     * @return the id of the queued data point
     */
    public String submit(DataPoint dataPoint) {
        DataPoint queued = dataPoint.getId() != null
                ? dataPoint
                : dataPoint.toBuilder().id(UUID.randomUUID().toString()).build();
        queue.add(queued);
        size.incrementAndGet();
        return queued.getId();
    }

    @Override
    public List<DataPoint> listPending(int limit) {
        List<DataPoint> taken = new ArrayList<>();
        DataPoint next;
        while (taken.size() < limit && (next = queue.poll()) != null) {
            size.decrementAndGet();
            taken.add(next);
        }
        return taken;
    }

    public int size() {
        return size.get();
    }
}
