package io.github.riemr.maintenance.application.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import io.github.riemr.maintenance.application.dto.QuarterSchedule;
import io.github.riemr.maintenance.application.dto.ScheduleWarning;
import io.github.riemr.maintenance.application.dto.Visit;
import io.github.riemr.maintenance.application.dto.VisitLineItem;
import io.github.riemr.maintenance.application.dto.WarningSeverity;
import io.github.riemr.maintenance.application.util.QuarterMonthUtils;
import io.github.riemr.maintenance.domain.model.SchedulingPolicy;
import lombok.RequiredArgsConstructor;

/**
 * 完成したスケジュールの事後チェック。スケジュール自体は変更せず警告のみ返す。
 */
@Service
@RequiredArgsConstructor
public class ScheduleValidationService {

    private final SchedulingPolicy schedulingPolicy;

    public List<ScheduleWarning> validate(List<QuarterSchedule> quarters) {
        List<ScheduleWarning> warnings = new ArrayList<>();
        warnings.addAll(checkWeather(quarters));
        warnings.addAll(checkBalance(quarters));
        return warnings;
    }

    List<ScheduleWarning> checkWeather(List<QuarterSchedule> quarters) {
        List<ScheduleWarning> warnings = new ArrayList<>();
        for (QuarterSchedule quarter : quarters) {
            if (!quarter.isWinter()) continue;
            Set<String> services = new LinkedHashSet<>();
            for (Visit visit : quarter.getVisits()) {
                for (VisitLineItem item : visit.getItems()) {
                    if (item.isWeatherSensitive()) {
                        services.add(item.getServiceName());
                    }
                }
            }
            if (services.isEmpty()) continue;
            warnings.add(ScheduleWarning.builder()
                    .quarter(quarter.getIndex())
                    .quarterLabel(quarter.getLabel())
                    .severity(WarningSeverity.WARNING)
                    .message(String.join(", ", services) + " scheduled in winter month")
                    .recommendation("Consider rescheduling to avoid temporary cable issues in cold weather")
                    .build());
        }
        return warnings;
    }

    List<ScheduleWarning> checkBalance(List<QuarterSchedule> quarters) {
        List<ScheduleWarning> warnings = new ArrayList<>();
        if (quarters.isEmpty()) return warnings;

        BigDecimal sum = quarters.stream().map(QuarterSchedule::getTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal average = sum.divide(BigDecimal.valueOf(quarters.size()), 4, RoundingMode.HALF_UP);
        if (average.signum() == 0) return warnings;

        BigDecimal limit = average.multiply(BigDecimal.valueOf(schedulingPolicy.getConcentrationFactor()));
        for (QuarterSchedule quarter : quarters) {
            if (quarter.getTotal().compareTo(limit) > 0) {
                warnings.add(ScheduleWarning.builder()
                        .quarter(quarter.getIndex())
                        .quarterLabel(quarter.getLabel())
                        .severity(WarningSeverity.INFO)
                        .message("High cost quarter ($" + QuarterMonthUtils.formatMoney(quarter.getTotal())
                                + " vs avg $" + QuarterMonthUtils.formatMoney(average) + ")")
                        .recommendation("Services heavily concentrated in this quarter - may impact cashflow")
                        .build());
            }
        }
        return warnings;
    }
}
