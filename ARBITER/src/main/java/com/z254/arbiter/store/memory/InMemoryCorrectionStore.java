package com.z254.arbiter.store.memory;

import com.z254.arbiter.domain.model.CorrectionRecord;
import com.z254.arbiter.store.CorrectionStore;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryCorrectionStore implements CorrectionStore {

    private final List<CorrectionRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Void> append(CorrectionRecord record) {
        return Mono.fromRunnable(() -> records.add(record));
    }

    public List<CorrectionRecord> records() {
        return List.copyOf(records);
    }
}
