package com.platform.clonegovernance.lifecycle;

import com.platform.clonegovernance.compliance.ComplianceScanner;
import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.retention.RetentionPurger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops background jobs when the application context closes.
 *
 * A running compliance scan or retention purge is asked to cancel; both stop at their
 * next batch boundary and keep what they already committed.
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {

    private final ComplianceScanner complianceScanner;
    private final RetentionPurger retentionPurger;
    private final MetricsRegistry metricsRegistry;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownManager(
            ComplianceScanner complianceScanner,
            RetentionPurger retentionPurger,
            MetricsRegistry metricsRegistry) {
        this.complianceScanner = complianceScanner;
        this.retentionPurger = retentionPurger;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public void performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        log.info("Graceful shutdown: cancelling background jobs");

        if (complianceScanner.isRunning()) {
            log.info("Cancelling running compliance scan");
            complianceScanner.cancel();
        }
        if (retentionPurger.isRunning()) {
            log.info("Cancelling running retention purge");
            retentionPurger.cancel();
        }

        metricsRegistry.incrementCounter("clonegovernance.lifecycle.shutdown", "status", "complete");
    }
}
