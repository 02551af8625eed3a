package io.github.riemr.maintenance.application.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import io.github.riemr.maintenance.application.dto.QuarterAnchor;
import io.github.riemr.maintenance.application.dto.Visit;
import io.github.riemr.maintenance.application.dto.VisitLineItem;
import io.github.riemr.maintenance.application.util.QuarterMonthUtils;
import io.github.riemr.maintenance.domain.model.CouplingRule;
import io.github.riemr.maintenance.domain.model.LaborHourTable;
import io.github.riemr.maintenance.domain.model.SchedulingPolicy;
import io.github.riemr.maintenance.domain.model.ServiceAssignment;
import io.github.riemr.maintenance.domain.model.ServiceCatalog;
import io.github.riemr.maintenance.domain.model.WeatherProfile;
import io.github.riemr.maintenance.util.ServiceCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 四半期内の作業を日単位の訪問へ詰める（貪欲ビンパッキング）。
 *
 * ロジック：
 * 1. 年間回数の多い順（安定ソート）に処理する
 * 2. 1日の上限時間を超える場合は現在の訪問を閉じて次の日へ
 * 3. heavy サービスは単独の訪問にする（heavy 同士を同日に組まない）
 * 4. 同乗ルール対象の軽作業は、条件を満たす主サービスの訪問に後から追加する。満たさなければ単独訪問
 * 5. 上限を単独で超える作業も落とさず、超過フラグ付きの単独訪問にする
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrewBundlingService {

    static final String NOTE_DRY_WEATHER = "Dry weather required";

    private final LaborHourTable laborHourTable;
    private final ServiceCatalog serviceCatalog;
    private final SchedulingPolicy schedulingPolicy;

    public List<Visit> bundle(QuarterAnchor quarter,
                              List<ServiceAssignment> occurrences,
                              double maxDailyHours,
                              WeatherProfile weatherProfile) {
        List<VisitLineItem> ordered = new ArrayList<>();
        for (ServiceAssignment a : occurrences) {
            ordered.add(toLineItem(a));
        }
        ordered.sort(Comparator.comparingInt(VisitLineItem::getFrequency).reversed());

        List<Visit> visits = new ArrayList<>();
        List<VisitLineItem> deferred = new ArrayList<>();
        Visit current = null;

        for (VisitLineItem item : ordered) {
            if (schedulingPolicy.couplingRuleFor(item.getServiceCode()).isPresent()) {
                deferred.add(item);
                continue;
            }
            if (item.getHours() > maxDailyHours || item.isHeavy()) {
                current = close(visits, current);
                visits.add(dedicatedVisit(item, maxDailyHours));
                continue;
            }
            if (current != null && current.getTotalHours() + item.getHours() > maxDailyHours) {
                current = close(visits, current);
            }
            if (current == null) {
                current = new Visit();
            }
            current.addItem(item);
        }
        close(visits, current);

        for (VisitLineItem item : deferred) {
            CouplingRule rule = schedulingPolicy.couplingRuleFor(item.getServiceCode()).orElseThrow();
            Optional<Visit> host = findCouplingHost(visits, item, rule, maxDailyHours);
            if (host.isPresent()) {
                Visit visit = host.get();
                String primary = visit.getItems().stream()
                        .filter(i -> isCouplingPrimary(i, item, rule))
                        .map(VisitLineItem::getServiceCode)
                        .findFirst()
                        .orElse("?");
                visit.addItem(item);
                visit.getNotes().add("Lightweight unit - coupled " + primary + " and " + item.getServiceCode() + " services");
            } else {
                visits.add(dedicatedVisit(item, maxDailyHours));
            }
        }

        numberVisits(quarter, visits, weatherProfile);
        log.debug("{}: {} occurrences packed into {} visits (max {}h/day)",
                quarter.label(), occurrences.size(), visits.size(), maxDailyHours);
        return visits;
    }

    VisitLineItem toLineItem(ServiceAssignment assignment) {
        double kw = assignment.getUnit().getKw();
        String code = ServiceCodes.normalize(assignment.getServiceCode());
        double hours = laborHourTable.hours(code, kw);
        return VisitLineItem.builder()
                .unitId(assignment.getUnit().getId())
                .unitName(assignment.getUnit().getDisplayName())
                .kw(kw)
                .serviceCode(code)
                .serviceName(assignment.getServiceName() != null ? assignment.getServiceName() : serviceCatalog.nameOf(code))
                .frequency(assignment.getEffectiveFrequency())
                .hours(hours)
                .heavy(laborHourTable.isHeavy(code, kw, schedulingPolicy.getHeavyThresholdHours()))
                .weatherSensitive(serviceCatalog.isWeatherSensitive(code))
                .source(assignment)
                .build();
    }

    private Optional<Visit> findCouplingHost(List<Visit> visits, VisitLineItem item, CouplingRule rule, double maxDailyHours) {
        if (item.isHeavy() || item.getKw() > rule.maxKw()) {
            return Optional.empty();
        }
        return visits.stream()
                .filter(v -> !v.isOverCapacity())
                .filter(v -> v.getItems().stream().anyMatch(i -> isCouplingPrimary(i, item, rule)))
                .filter(v -> v.getTotalHours() + item.getHours() <= maxDailyHours)
                .findFirst();
    }

    private static boolean isCouplingPrimary(VisitLineItem candidate, VisitLineItem secondary, CouplingRule rule) {
        return !candidate.isHeavy()
                && rule.isPrimary(candidate.getServiceCode())
                && candidate.getUnitId().equals(secondary.getUnitId());
    }

    private static Visit dedicatedVisit(VisitLineItem item, double maxDailyHours) {
        Visit visit = new Visit();
        visit.addItem(item);
        if (item.getHours() > maxDailyHours) {
            visit.setOverCapacity(true);
            visit.getNotes().add("Exceeds daily crew capacity (" + QuarterMonthUtils.formatHours(item.getHours())
                    + " of " + QuarterMonthUtils.formatHours(maxDailyHours) + " hours) - plan a multi-day visit");
        }
        return visit;
    }

    private static Visit close(List<Visit> visits, Visit current) {
        if (current != null && !current.getItems().isEmpty()) {
            visits.add(current);
        }
        return null;
    }

    private static void numberVisits(QuarterAnchor quarter, List<Visit> visits, WeatherProfile weatherProfile) {
        for (int i = 0; i < visits.size(); i++) {
            Visit visit = visits.get(i);
            visit.setQuarter(quarter.index());
            visit.setDay(i + 1);
            if (visit.hasWeatherSensitiveItem()) {
                // 天候次第のため日付未定
                visit.setDate(null);
                visit.getNotes().add(NOTE_DRY_WEATHER + " - schedule during "
                        + QuarterMonthUtils.monthList(weatherProfile.preferredMonths()));
            } else {
                visit.setDate(quarter.anchorDate().plusDays(i));
            }
        }
    }
}
