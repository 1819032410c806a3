package com.platform.podset.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.LivenessState;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Operator lifecycle phase, published to Spring Boot's availability state for the probes.
 *
 * STARTING -> READY (informers and workers running) -> DRAINING (shutdown requested) -> STOPPED
 */
@Slf4j
@Component
public class ApplicationLifecycleManager {

    private final ApplicationEventPublisher eventPublisher;
    private final AtomicReference<LifecyclePhase> currentPhase = new AtomicReference<>(LifecyclePhase.STARTING);
    private volatile Instant phaseStartTime = Instant.now();

    public ApplicationLifecycleManager(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    public void markReady() {
        if (currentPhase.compareAndSet(LifecyclePhase.STARTING, LifecyclePhase.READY)) {
            phaseStartTime = Instant.now();
            log.info("Operator marked READY");
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.ACCEPTING_TRAFFIC);
        }
    }

    /**
     * Stop reporting ready. Called first on shutdown.
     */
    public void startDraining() {
        LifecyclePhase previous = currentPhase.getAndSet(LifecyclePhase.DRAINING);
        if (previous != LifecyclePhase.DRAINING) {
            phaseStartTime = Instant.now();
            log.info("Operator entering DRAINING phase (was {})", previous);
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.REFUSING_TRAFFIC);
        }
    }

    public void markStopped() {
        LifecyclePhase previous = currentPhase.getAndSet(LifecyclePhase.STOPPED);
        phaseStartTime = Instant.now();
        log.info("Operator marked STOPPED (was {})", previous);
        AvailabilityChangeEvent.publish(eventPublisher, this, LivenessState.BROKEN);
    }

    public LifecyclePhase getCurrentPhase() {
        return currentPhase.get();
    }

    public boolean isReady() {
        return currentPhase.get() == LifecyclePhase.READY;
    }

    public boolean isDraining() {
        return currentPhase.get() == LifecyclePhase.DRAINING;
    }

    public long getTimeInCurrentPhaseMs() {
        return Instant.now().toEpochMilli() - phaseStartTime.toEpochMilli();
    }

    public LifecycleStatus getStatus() {
        return new LifecycleStatus(currentPhase.get(), phaseStartTime, getTimeInCurrentPhaseMs());
    }

    public enum LifecyclePhase {
        STARTING,
        READY,
        DRAINING,
        STOPPED
    }

    public record LifecycleStatus(
        LifecyclePhase phase,
        Instant phaseStartTime,
        long durationMs
    ) {}
}
