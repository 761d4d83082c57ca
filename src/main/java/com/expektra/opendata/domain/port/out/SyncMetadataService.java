package com.expektra.opendata.domain.port.out;

import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.SyncRecord;

import java.util.Optional;

/**
 * Best-effort record of the last upstream fetch per series-key.
 */
public interface SyncMetadataService {

    void recordSuccess(SyncRecord record);

    void recordFailure(SyncRecord record);

    Optional<SyncRecord> lastSync(SeriesKey key);
}
