package io.github.riemr.maintenance.application.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import io.github.riemr.maintenance.application.dto.DistributionResult;
import io.github.riemr.maintenance.application.dto.LaborHourLookupDto;
import io.github.riemr.maintenance.application.dto.QuarterAnchor;
import io.github.riemr.maintenance.application.dto.QuarterSchedule;
import io.github.riemr.maintenance.application.dto.Schedule;
import io.github.riemr.maintenance.application.dto.ScheduleNotes;
import io.github.riemr.maintenance.application.dto.ScheduleRequest;
import io.github.riemr.maintenance.application.dto.ScheduleSummary;
import io.github.riemr.maintenance.application.dto.ScheduleWarning;
import io.github.riemr.maintenance.application.dto.Visit;
import io.github.riemr.maintenance.application.dto.VisitLineItem;
import io.github.riemr.maintenance.application.dto.WarningSeverity;
import io.github.riemr.maintenance.application.util.QuarterMonthUtils;
import io.github.riemr.maintenance.domain.model.Contract;
import io.github.riemr.maintenance.domain.model.LaborHourTable;
import io.github.riemr.maintenance.domain.model.SchedulingPolicy;
import io.github.riemr.maintenance.domain.model.ServiceAssignment;
import io.github.riemr.maintenance.domain.model.ServiceCatalog;
import io.github.riemr.maintenance.domain.model.ServiceDefinition;
import io.github.riemr.maintenance.domain.model.WeatherProfile;
import io.github.riemr.maintenance.domain.model.WeatherProfileRegistry;
import io.github.riemr.maintenance.util.ServiceCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 年間保守スケジュールの生成を制御するサービス。
 * <ul>
 *   <li>契約開始日 → 四半期カレンダー</li>
 *   <li>年間回数・天候に応じた四半期配分</li>
 *   <li>クルー能力に応じた訪問への詰め込み</li>
 *   <li>費用集計と事後チェック</li>
 * </ul>
 * 呼び出しごとに新しいオブジェクトを組み立てるだけで共有状態は持たない。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaintenanceScheduleService {

    /* === Collaborators === */
    private final ContractCalendarService calendarService;
    private final FrequencyDistributionService distributionService;
    private final CrewBundlingService bundlingService;
    private final CostAggregationService costAggregationService;
    private final ScheduleValidationService validationService;
    private final WeatherProfileRegistry weatherProfileRegistry;
    private final LaborHourTable laborHourTable;
    private final ServiceCatalog serviceCatalog;
    private final SchedulingPolicy schedulingPolicy;

    /* ===================================================================== */
    /* Public API                                                            */
    /* ===================================================================== */

    public Schedule generate(ScheduleRequest request) {
        List<ScheduleWarning> warnings = new ArrayList<>();
        if (request.hasInvalidStartDate()) {
            log.warn("Unparsable start date '{}', using today", request.getStartDate());
            warnings.add(ScheduleWarning.builder()
                    .severity(WarningSeverity.INFO)
                    .message("Invalid start date '" + request.getStartDate() + "' - using today's date")
                    .recommendation("Enter the contract start date as YYYY-MM-DD")
                    .build());
        }
        return generate(request.toContract(schedulingPolicy), request.toAssignments(), warnings);
    }

    public Schedule generate(Contract contract, List<ServiceAssignment> assignments) {
        return generate(contract, assignments, new ArrayList<>());
    }

    private Schedule generate(Contract contract, List<ServiceAssignment> assignments, List<ScheduleWarning> warnings) {
        WeatherProfile profile = resolveProfile(contract.getWeatherProfileKey(), warnings);
        LocalDate startDate = calendarService.resolveStartDate(contract.getStartDate());
        double maxDailyHours = contract.getMaxDailyHours();

        log.info("Generating maintenance schedule: start={}, assignments={}, maxDailyHours={}, profile={}",
                startDate, assignments.size(), maxDailyHours, profile.key());

        List<QuarterAnchor> anchors = calendarService.generateQuarters(startDate);
        DistributionResult distribution = distributionService.distribute(assignments, anchors, profile);
        warnings.addAll(distribution.warnings());

        List<QuarterSchedule> quarters = new ArrayList<>();
        for (QuarterAnchor anchor : anchors) {
            List<Visit> visits = bundlingService.bundle(anchor, distribution.placementsFor(anchor.index()), maxDailyHours, profile);
            quarters.add(QuarterSchedule.builder()
                    .index(anchor.index())
                    .label(anchor.label())
                    .month(anchor.month())
                    .anchorDate(anchor.anchorDate())
                    .winter(profile.isWinter(anchor.month()))
                    .visits(visits)
                    .build());
        }

        costAggregationService.applyCosts(quarters);
        BigDecimal annualTotal = costAggregationService.annualTotal(quarters);
        BigDecimal contracted = costAggregationService.contractedAnnualTotal(assignments);
        if (annualTotal.compareTo(contracted) != 0) {
            // 配分ロジックの不整合。スケジュールは返すがログに残す
            log.error("Annual total {} does not match contracted total {}", annualTotal, contracted);
        }

        warnings.addAll(validationService.validate(quarters));

        boolean weatherSensitive = assignments.stream()
                .anyMatch(a -> serviceCatalog.isWeatherSensitive(a.getServiceCode()));

        Schedule schedule = Schedule.builder()
                .startDate(startDate)
                .firstServiceMonth(QuarterMonthUtils.firstServiceMonth(startDate))
                .weatherProfile(profile.key())
                .maxDailyHours(maxDailyHours)
                .quarters(quarters)
                .annualTotal(annualTotal)
                .warnings(warnings)
                .summary(summarize(quarters, annualTotal))
                .notes(ScheduleNotes.of(weatherSensitive))
                .build();

        log.info("Schedule generated: {} visits, annual total {}, {} warnings",
                schedule.getSummary().getTotalDays(), annualTotal, warnings.size());
        return schedule;
    }

    public LaborHourLookupDto lookupLaborHours(String serviceCode, double kw) {
        String code = ServiceCodes.normalize(serviceCode);
        if (code == null) {
            throw new IllegalArgumentException("service is required");
        }
        double hours = laborHourTable.hours(code, kw);
        return new LaborHourLookupDto(code, kw, laborHourTable.bracketFor(kw).label(), hours,
                laborHourTable.isHeavy(code, kw, schedulingPolicy.getHeavyThresholdHours()));
    }

    public List<ServiceDefinition> listServices() {
        return serviceCatalog.all();
    }

    /* ===================================================================== */
    /* Internal                                                              */
    /* ===================================================================== */

    private WeatherProfile resolveProfile(String key, List<ScheduleWarning> warnings) {
        if (key == null || key.isBlank()) {
            return weatherProfileRegistry.getDefaultProfile();
        }
        return weatherProfileRegistry.find(key).orElseGet(() -> {
            WeatherProfile fallback = weatherProfileRegistry.getDefaultProfile();
            log.warn("Unknown weather profile '{}', using {}", key, fallback.key());
            warnings.add(ScheduleWarning.builder()
                    .severity(WarningSeverity.INFO)
                    .message("Unknown weather profile '" + key + "' - using " + fallback.key())
                    .recommendation("Confirm the site region so winter months are classified correctly")
                    .build());
            return fallback;
        });
    }

    ScheduleSummary summarize(List<QuarterSchedule> quarters, BigDecimal annualTotal) {
        int totalDays = 0;
        double totalHours = 0;
        Map<String, Integer> servicesPerformed = new TreeMap<>();
        Map<String, Integer> visitsPerQuarter = new LinkedHashMap<>();

        for (QuarterSchedule quarter : quarters) {
            totalDays += quarter.getVisits().size();
            visitsPerQuarter.put(quarter.getLabel(), quarter.getVisits().size());
            for (Visit visit : quarter.getVisits()) {
                totalHours += visit.getTotalHours();
                for (VisitLineItem item : visit.getItems()) {
                    servicesPerformed.merge(item.getServiceCode(), 1, Integer::sum);
                }
            }
        }

        return ScheduleSummary.builder()
                .totalDays(totalDays)
                .totalHours(totalHours)
                .averageHoursPerDay(totalDays == 0 ? 0 : totalHours / totalDays)
                .servicesPerformed(servicesPerformed)
                .visitsPerQuarter(visitsPerQuarter)
                .annualTotal(annualTotal)
                .build();
    }
}
