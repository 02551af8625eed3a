package io.github.riemr.maintenance.domain.model;

/**
 * 発電機容量(kW)の区分。下限・上限ともに含む。
 */
public record CapacityBracket(String label, double minKw, double maxKw) {

    public CapacityBracket {
        if (maxKw < minKw) {
            throw new IllegalArgumentException("maxKw must be >= minKw: " + label);
        }
    }

    public boolean contains(double kw) {
        return kw >= minKw && kw <= maxKw;
    }
}
