package com.medwatch.anomaly.service;

import com.medwatch.anomaly.model.DataPoint;

import java.util.List;

/**
 * Supplier of data points awaiting detection. Returned points are considered taken and are
 * not returned again.
 */
public interface DataPointSource {

    String getName();

    List<DataPoint> listPending(int limit);
}
