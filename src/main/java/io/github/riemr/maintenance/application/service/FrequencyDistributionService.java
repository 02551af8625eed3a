package io.github.riemr.maintenance.application.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import io.github.riemr.maintenance.application.dto.DistributionResult;
import io.github.riemr.maintenance.application.dto.QuarterAnchor;
import io.github.riemr.maintenance.application.dto.ScheduleWarning;
import io.github.riemr.maintenance.application.dto.WarningSeverity;
import io.github.riemr.maintenance.application.util.QuarterMonthUtils;
import io.github.riemr.maintenance.domain.model.ServiceAssignment;
import io.github.riemr.maintenance.domain.model.ServiceCatalog;
import io.github.riemr.maintenance.domain.model.WeatherProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 契約サービスを年間回数に応じて四半期へ配分する。
 * <ul>
 *   <li>年4回 → Q1〜Q4</li>
 *   <li>年2回 → Q1, Q3</li>
 *   <li>年1回 → Q1</li>
 * </ul>
 * 天候依存サービス（ロードバンク試験）は冬季四半期を避けて配置し、
 * 避けきれない場合は警告を付けて冬季にも配置する。配置回数は常に契約回数と一致する。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FrequencyDistributionService {

    private final ServiceCatalog serviceCatalog;

    public DistributionResult distribute(List<ServiceAssignment> assignments,
                                         List<QuarterAnchor> quarters,
                                         WeatherProfile weatherProfile) {
        Map<Integer, List<ServiceAssignment>> placements = new LinkedHashMap<>();
        for (QuarterAnchor q : quarters) {
            placements.put(q.index(), new ArrayList<>());
        }
        List<ScheduleWarning> warnings = new ArrayList<>();

        for (ServiceAssignment assignment : assignments) {
            List<Integer> indices = serviceCatalog.isWeatherSensitive(assignment.getServiceCode())
                    ? weatherAwareQuarters(assignment, quarters, weatherProfile, warnings)
                    : defaultQuarters(assignment.getEffectiveFrequency());
            for (Integer index : indices) {
                placements.get(index).add(assignment);
            }
        }

        placements.forEach((index, list) -> log.debug("Quarter {}: {} occurrences placed", index, list.size()));
        return new DistributionResult(placements, warnings);
    }

    public List<Integer> defaultQuarters(int frequency) {
        switch (frequency) {
            case 4:
                return List.of(1, 2, 3, 4);
            case 2:
                return List.of(1, 3);
            case 1:
            default:
                return List.of(1);
        }
    }

    /* ===================================================================== */
    /* 天候回避                                                              */
    /* ===================================================================== */

    List<Integer> weatherAwareQuarters(ServiceAssignment assignment,
                                       List<QuarterAnchor> quarters,
                                       WeatherProfile weatherProfile,
                                       List<ScheduleWarning> warnings) {
        int required = assignment.getEffectiveFrequency();
        List<Integer> nonWinter = new ArrayList<>();
        List<Integer> winter = new ArrayList<>();
        for (QuarterAnchor q : quarters) {
            if (weatherProfile.isWinter(q.month())) {
                winter.add(q.index());
            } else {
                nonWinter.add(q.index());
            }
        }

        if (nonWinter.size() >= required) {
            return chooseNonWinter(required, nonWinter);
        }

        String serviceName = serviceCatalog.nameOf(assignment.getServiceCode());
        String unitName = assignment.getUnit().getDisplayName();

        if (nonWinter.isEmpty()) {
            // 全四半期が冬季：既定配置のまま警告のみ
            log.warn("All quarters are winter for profile {} - {} on {} keeps default placement",
                    weatherProfile.key(), serviceName, unitName);
            warnings.add(ScheduleWarning.builder()
                    .severity(WarningSeverity.WARNING)
                    .message("Weather avoidance could not be honored for " + serviceName + " on " + unitName
                            + ": every quarter falls in a winter month")
                    .recommendation("Manual scheduling required - confirm cold-weather testing with the customer")
                    .build());
            return defaultQuarters(required);
        }

        // 非冬季を優先し、不足分は早い冬季四半期で補う
        List<Integer> chosen = new ArrayList<>(nonWinter);
        List<Integer> forced = winter.subList(0, required - nonWinter.size());
        chosen.addAll(forced);
        chosen.sort(Integer::compareTo);

        for (Integer index : forced) {
            QuarterAnchor q = quarters.get(index - 1);
            log.warn("{} on {} forced into winter quarter {}", serviceName, unitName, q.label());
            warnings.add(ScheduleWarning.builder()
                    .quarter(q.index())
                    .quarterLabel(q.label())
                    .severity(WarningSeverity.WARNING)
                    .message(serviceName + " on " + unitName + " forced into winter quarter " + q.label()
                            + " (" + nonWinter.size() + " of " + required + " placements avoid winter)")
                    .recommendation("Schedule during " + QuarterMonthUtils.monthList(weatherProfile.preferredMonths())
                            + " where possible")
                    .build());
        }
        return chosen;
    }

    private List<Integer> chooseNonWinter(int required, List<Integer> nonWinter) {
        if (required == 2) {
            boolean q1Safe = nonWinter.contains(1);
            boolean q3Safe = nonWinter.contains(3);
            if (q1Safe && q3Safe) return List.of(1, 3);
            if (q1Safe) return sorted(1, firstOtherThan(nonWinter, 1));
            if (q3Safe) return sorted(firstOtherThan(nonWinter, 3), 3);
        }
        return List.copyOf(nonWinter.subList(0, required));
    }

    private static int firstOtherThan(List<Integer> candidates, int excluded) {
        return candidates.stream().filter(i -> i != excluded).findFirst().orElseThrow();
    }

    private static List<Integer> sorted(int a, int b) {
        return a < b ? List.of(a, b) : List.of(b, a);
    }
}
