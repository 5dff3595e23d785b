package com.sandy.netwatch.monitor.service;

import com.sandy.netwatch.monitor.model.AlertRecord;

/**
 * Receiver of threshold, anomaly and monitor health records. Implementations must not throw.
 */
public interface AlertSink {

    void publish(AlertRecord record);
}
