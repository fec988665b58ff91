package com.z254.butterfly.hermes.resource;

import com.z254.butterfly.hermes.domain.model.ResourceUtilization;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;

/**
 * Measures CPU from the system load average and memory from the JVM heap.
 * Network and storage are not measured and always report 0.
 */
@Component
public class JvmResourceUtilizationProbe implements ResourceUtilizationProbe {

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public ResourceUtilization sample() {
        return ResourceUtilization.builder()
                .cpu(cpuPercent())
                .memory(heapPercent())
                .network(0)
                .storage(0)
                .build();
    }

    private double cpuPercent() {
        double loadAverage = os.getSystemLoadAverage();
        if (loadAverage < 0) {
            return 0;
        }
        return Math.min(100.0, loadAverage / os.getAvailableProcessors() * 100.0);
    }

    private double heapPercent() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        if (max <= 0) {
            return 0;
        }
        return Math.min(100.0, (double) heap.getUsed() / max * 100.0);
    }
}
