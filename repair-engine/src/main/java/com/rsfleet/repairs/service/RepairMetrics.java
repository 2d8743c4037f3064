package com.rsfleet.repairs.service;

import com.rsfleet.repairs.error.RepairEngineException;
import com.rsfleet.repairs.model.Repair;
import com.rsfleet.repairs.model.RepairStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Micrometer instruments for the repair engine.
 *
 * <pre>
 *   rsfleet.repairs.created{origin, status}
 *   rsfleet.repairs.transitions{from, to}
 *   rsfleet.batch.duration{outcome="committed|rejected"}
 *   rsfleet.batch.failures{kind}
 * </pre>
 */
@Component
public class RepairMetrics {

    private final MeterRegistry meterRegistry;

    public RepairMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public Timer.Sample startBatch() {
        return Timer.start(meterRegistry);
    }

    public void batchCommitted(Timer.Sample sample, List<Repair> repairs) {
        sample.stop(meterRegistry.timer("rsfleet.batch.duration", "outcome", "committed"));
        for (Repair r : repairs) {
            meterRegistry.counter("rsfleet.repairs.created",
                    "origin", r.getOrigin().name().toLowerCase(),
                    "status", r.getStatus().name().toLowerCase()).increment();
        }
    }

    public void batchRejected(Timer.Sample sample, RepairEngineException.Kind kind) {
        sample.stop(meterRegistry.timer("rsfleet.batch.duration", "outcome", "rejected"));
        meterRegistry.counter("rsfleet.batch.failures", "kind", kind.name().toLowerCase()).increment();
    }

    public void transition(RepairStatus from, RepairStatus to) {
        meterRegistry.counter("rsfleet.repairs.transitions",
                "from", from.name().toLowerCase(),
                "to",   to.name().toLowerCase()).increment();
    }
}
