package com.dvc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-challenge resource request. Values above the security profile's ceiling
 * are clamped when the container is created.
 *
 * @param memoryMb  memory limit in megabytes
 * @param cpus      fractional CPU count (0.5 = half a core)
 * @param pidsLimit maximum number of processes inside the container
 */
public record ResourceLimits(
    @JsonProperty("memory_mb") int memoryMb,
    double cpus,
    @JsonProperty("pids_limit") int pidsLimit
) {

    private static final int DEFAULT_MEMORY_MB = 256;
    private static final double DEFAULT_CPUS = 0.5;
    private static final int DEFAULT_PIDS = 128;

    public static final ResourceLimits DEFAULT =
            new ResourceLimits(DEFAULT_MEMORY_MB, DEFAULT_CPUS, DEFAULT_PIDS);

    public ResourceLimits {
        if (memoryMb <= 0) memoryMb = DEFAULT_MEMORY_MB;
        if (cpus <= 0) cpus = DEFAULT_CPUS;
        if (pidsLimit <= 0) pidsLimit = DEFAULT_PIDS;
    }

    /**
     * Returns these limits capped at {@code ceiling}.
     */
    public ResourceLimits clampTo(ResourceLimits ceiling) {
        return new ResourceLimits(
                Math.min(memoryMb, ceiling.memoryMb()),
                Math.min(cpus, ceiling.cpus()),
                Math.min(pidsLimit, ceiling.pidsLimit()));
    }
}
