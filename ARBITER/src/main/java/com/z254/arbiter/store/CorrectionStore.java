package com.z254.arbiter.store;

import com.z254.arbiter.domain.model.CorrectionRecord;
import reactor.core.publisher.Mono;

/**
 * Long-term record of corrected labels, consumed by batch retraining.
 */
public interface CorrectionStore {

    Mono<Void> append(CorrectionRecord record);
}
