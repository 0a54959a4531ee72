package com.memory.validation.repository;

import com.memory.validation.config.FeedbackConfig;
import com.memory.validation.model.ValidationFeedback;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Rolling, append-only log of human feedback. The oldest items drop off once retention is reached.
 */
@Repository
public class FeedbackRepository {

    private final Deque<ValidationFeedback> items = new ArrayDeque<>();
    private final int retention;

    public FeedbackRepository(FeedbackConfig feedbackConfig) {
        this.retention = Math.max(1, feedbackConfig.getRetention());
    }

    public synchronized void append(ValidationFeedback feedback) {
        items.addLast(feedback);
        while (items.size() > retention) {
            items.removeFirst();
        }
    }

    /**
     * The newest {@code limit} items in submission order (oldest first).
     */
    public synchronized List<ValidationFeedback> recent(int limit) {
        int take = Math.min(Math.max(0, limit), items.size());
        List<ValidationFeedback> result = new ArrayList<>(take);
        Iterator<ValidationFeedback> newestFirst = items.descendingIterator();
        while (result.size() < take && newestFirst.hasNext()) {
            result.add(newestFirst.next());
        }
        Collections.reverse(result);
        return result;
    }

    public synchronized int size() {
        return items.size();
    }
}
