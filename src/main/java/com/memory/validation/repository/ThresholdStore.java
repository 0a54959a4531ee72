package com.memory.validation.repository;

import com.memory.validation.config.ValidationThresholdConfig;
import com.memory.validation.model.ConfigSource;
import com.memory.validation.model.ThresholdConfig;
import com.memory.validation.model.ThresholdVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active threshold version and the versions it replaced.
 *
 * Readers take {@link #current()} once and keep using that immutable snapshot; a publish
 * never changes a snapshot someone already holds. Writes come from the calibration service only.
 */
@Repository
public class ThresholdStore {

    private static final Logger log = LoggerFactory.getLogger(ThresholdStore.class);

    private final AtomicReference<ThresholdVersion> active;

    // Versions superseded by the active one, most recent first
    private final Deque<ThresholdVersion> superseded = new ArrayDeque<>();
    private long lastVersion;

    public ThresholdStore(ValidationThresholdConfig startupConfig) {
        ThresholdVersion initial = ThresholdVersion.builder()
                .version(1L)
                .config(startupConfig.toThresholdConfig())
                .source(ConfigSource.STARTUP)
                .reason("Startup configuration")
                .activatedAt(System.currentTimeMillis())
                .build();
        this.active = new AtomicReference<>(initial);
        this.lastVersion = 1L;
        log.info("Threshold store initialised: approve={}, review={}, reject={}",
                initial.getConfig().getAutoApprove(), initial.getConfig().getReviewRequired(),
                initial.getConfig().getAutoReject());
    }

    public ThresholdVersion current() {
        return active.get();
    }

    public ThresholdConfig currentConfig() {
        return active.get().getConfig();
    }

    public synchronized ThresholdVersion publish(ThresholdConfig config, ConfigSource source, String reason) {
        ThresholdVersion next = ThresholdVersion.builder()
                .version(++lastVersion)
                .config(config)
                .source(source)
                .reason(reason)
                .activatedAt(System.currentTimeMillis())
                .build();
        superseded.push(active.get());
        active.set(next);
        log.info("Published threshold version {} ({}): {}", next.getVersion(), source, reason);
        return next;
    }

    /**
     * Reinstate the version that the active one replaced. The reinstated version keeps its number.
     *
     * @return the reinstated version, or empty when there is nothing to roll back to
     */
    public synchronized Optional<ThresholdVersion> rollback() {
        ThresholdVersion previous = superseded.poll();
        if (previous == null) {
            return Optional.empty();
        }
        ThresholdVersion discarded = active.getAndSet(previous);
        log.warn("Rolled back threshold version {} to version {}", discarded.getVersion(), previous.getVersion());
        return Optional.of(previous);
    }

    /**
     * Active version first, then the versions it superseded.
     */
    public synchronized List<ThresholdVersion> history() {
        List<ThresholdVersion> versions = new ArrayList<>(superseded.size() + 1);
        versions.add(active.get());
        versions.addAll(superseded);
        return versions;
    }
}
