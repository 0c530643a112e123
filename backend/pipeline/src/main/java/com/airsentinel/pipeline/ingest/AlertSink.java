package com.airsentinel.pipeline.ingest;

import com.airsentinel.core.model.AlertRecord;

public interface AlertSink {
    void append(AlertRecord alert);
}
