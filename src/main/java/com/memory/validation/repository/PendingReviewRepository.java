package com.memory.validation.repository;

import com.memory.validation.model.ValidationDecision;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decisions waiting for a human verdict, keyed by record id. A newer decision for the same record replaces the older one.
 */
@Repository
public class PendingReviewRepository {

    private final Map<String, ValidationDecision> pending = new ConcurrentHashMap<>();

    public void save(ValidationDecision decision) {
        pending.put(decision.getRecordId(), decision);
    }

    public boolean remove(String recordId) {
        return pending.remove(recordId) != null;
    }

    public List<ValidationDecision> findAll() {
        return new ArrayList<>(pending.values());
    }

    public int size() {
        return pending.size();
    }
}
