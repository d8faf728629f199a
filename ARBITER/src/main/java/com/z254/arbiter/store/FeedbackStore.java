package com.z254.arbiter.store;

import com.z254.arbiter.domain.model.FeedbackRecord;
import reactor.core.publisher.Mono;

public interface FeedbackStore {

    Mono<Void> save(FeedbackRecord record);

    Mono<FeedbackRecord> find(String requestId);
}
