package io.github.riemr.maintenance.domain.model;

import java.util.List;
import java.util.Set;

/**
 * 地域ごとの天候プロファイル。
 *
 * @param key            プロファイルキー（例: DEFAULT, SACRAMENTO_CA）
 * @param winterMonths   天候依存サービスを避ける月（1..12）
 * @param preferredMonths 天候依存サービスの推奨月（訪問メモに表示）
 */
public record WeatherProfile(String key, Set<Integer> winterMonths, List<Integer> preferredMonths) {

    public WeatherProfile {
        winterMonths = Set.copyOf(winterMonths);
        preferredMonths = List.copyOf(preferredMonths);
    }

    public boolean isWinter(int month) {
        return winterMonths.contains(month);
    }
}
