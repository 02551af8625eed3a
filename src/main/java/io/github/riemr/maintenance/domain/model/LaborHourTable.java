package io.github.riemr.maintenance.domain.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.github.riemr.maintenance.util.ServiceCodes;

/**
 * サービスコード × 容量区分 → 1回あたりの作業時間(h) の参照表。
 * <p>
 * 区分は小さい順・重複なしで渡す。生成後は不変。区分外の容量は最も近い区分に丸める（最小未満→先頭、最大超→末尾）。
 * 区分に依存しないサービス（ラボ分析のみ等）は {@code flatHours} に登録する。
 * 表に無いサービスは 0 時間として扱う。
 */
public final class LaborHourTable {

    private final List<CapacityBracket> brackets;
    private final Map<String, List<Double>> bracketHours;
    private final Map<String, Double> flatHours;

    public LaborHourTable(List<CapacityBracket> brackets,
                          Map<String, List<Double>> bracketHours,
                          Map<String, Double> flatHours) {
        if (brackets == null || brackets.isEmpty()) {
            throw new IllegalArgumentException("at least one capacity bracket is required");
        }
        for (int i = 1; i < brackets.size(); i++) {
            if (brackets.get(i).minKw() <= brackets.get(i - 1).maxKw()) {
                throw new IllegalArgumentException("capacity brackets must be ascending and non-overlapping: "
                        + brackets.get(i - 1).label() + ", " + brackets.get(i).label());
            }
        }
        this.brackets = List.copyOf(brackets);

        Map<String, List<Double>> rows = new HashMap<>();
        for (Map.Entry<String, List<Double>> e : Objects.requireNonNullElse(bracketHours, Map.<String, List<Double>>of()).entrySet()) {
            if (e.getValue().size() != this.brackets.size()) {
                throw new IllegalArgumentException("service " + e.getKey() + " has " + e.getValue().size()
                        + " hour values for " + this.brackets.size() + " brackets");
            }
            rows.put(ServiceCodes.normalize(e.getKey()), List.copyOf(e.getValue()));
        }
        this.bracketHours = Map.copyOf(rows);

        Map<String, Double> flat = new HashMap<>();
        Objects.requireNonNullElse(flatHours, Map.<String, Double>of())
                .forEach((code, hours) -> flat.put(ServiceCodes.normalize(code), hours));
        this.flatHours = Map.copyOf(flat);
    }

    public List<CapacityBracket> getBrackets() {
        return brackets;
    }

    /** 容量以上の上限を持つ最初の区分。範囲外は端の区分に丸める。 */
    public CapacityBracket bracketFor(double kw) {
        int index = bracketIndex(kw);
        return brackets.get(index);
    }

    public double hours(String serviceCode, double kw) {
        String code = ServiceCodes.normalize(serviceCode);
        if (code == null) return 0;
        Double flat = flatHours.get(code);
        if (flat != null) return flat;
        List<Double> row = bracketHours.get(code);
        if (row == null) return 0;
        return row.get(bracketIndex(kw));
    }

    public boolean isHeavy(String serviceCode, double kw, double heavyThresholdHours) {
        return hours(serviceCode, kw) >= heavyThresholdHours;
    }

    private int bracketIndex(double kw) {
        // 二分探索で「上限 >= kw」の最初の区分を探す
        int lo = 0;
        int hi = brackets.size() - 1;
        if (kw > brackets.get(hi).maxKw()) return hi;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (brackets.get(mid).maxKw() >= kw) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
