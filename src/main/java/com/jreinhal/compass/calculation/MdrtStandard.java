package com.jreinhal.compass.calculation;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * MDRT achievement tiers and their annual thresholds in KRW.
 */
public enum MdrtStandard {
    FYC_MDRT("fycMdrt", 54_000_000L),
    FYC_COT("fycCot", 162_000_000L),
    FYC_TOT("fycTot", 324_000_000L),
    AGI_MDRT("agiMdrt", 97_200_000L),
    AGI_COT("agiCot", 291_600_000L),
    AGI_TOT("agiTot", 583_200_000L);

    private final String id;
    private final long threshold;

    MdrtStandard(String id, long threshold) {
        this.id = id;
        this.threshold = threshold;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public long threshold() {
        return threshold;
    }

    public boolean isFycBased() {
        return id.startsWith("fyc");
    }

    public static Optional<MdrtStandard> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (MdrtStandard standard : values()) {
            if (standard.id.equalsIgnoreCase(id.trim())) {
                return Optional.of(standard);
            }
        }
        return Optional.empty();
    }
}
