package com.ulio.vigil.comms;

import com.ulio.vigil.record.AnomalyRecord;

public interface AnomalyReporter extends AutoCloseable {
    void report(AnomalyRecord record);

    @Override
    default void close() {
    }
}
