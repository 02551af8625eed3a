package io.github.riemr.maintenance.application.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import io.github.riemr.maintenance.application.dto.QuarterSchedule;
import io.github.riemr.maintenance.application.dto.Schedule;
import io.github.riemr.maintenance.application.dto.ScheduleExportRow;
import io.github.riemr.maintenance.application.dto.Visit;
import io.github.riemr.maintenance.application.dto.VisitLineItem;
import io.github.riemr.maintenance.application.util.QuarterMonthUtils;

/**
 * PDF/CRM 向けの整形。
 */
@Service
public class ScheduleExportService {

    static final String DATE_TBD = "TBD";

    public List<ScheduleExportRow> toRows(Schedule schedule) {
        List<ScheduleExportRow> rows = new ArrayList<>();
        for (QuarterSchedule quarter : schedule.getQuarters()) {
            for (Visit visit : quarter.getVisits()) {
                Set<String> units = new LinkedHashSet<>();
                visit.getItems().forEach(i -> units.add(i.getUnitName()));
                String services = visit.getItems().stream()
                        .map(i -> i.getServiceCode() + " (" + QuarterMonthUtils.formatHours(i.getHours()) + "hr)")
                        .collect(Collectors.joining(", "));
                rows.add(new ScheduleExportRow(
                        quarter.getLabel(),
                        visit.getDay(),
                        visit.getDate() != null ? visit.getDate().toString() : DATE_TBD,
                        String.join(", ", units),
                        services,
                        visit.getTotalHours(),
                        String.join("; ", visit.getNotes())));
            }
        }
        return rows;
    }

    public String toText(Schedule schedule) {
        List<String> lines = new ArrayList<>();
        lines.add("Service Schedule (Start: " + schedule.getStartDate() + ")");
        lines.add("First Service Month: " + QuarterMonthUtils.monthAbbreviation(schedule.getFirstServiceMonth()));
        lines.add("");

        for (QuarterSchedule quarter : schedule.getQuarters()) {
            lines.add(quarter.getLabel() + " - $" + QuarterMonthUtils.formatMoney(quarter.getTotal()));
            for (Visit visit : quarter.getVisits()) {
                for (VisitLineItem item : visit.getItems()) {
                    lines.add("  • " + item.getServiceName() + " (" + item.getUnitName() + "): $"
                            + QuarterMonthUtils.formatMoney(item.getCost()));
                }
            }
        }

        lines.add("");
        lines.add("Total Annual: $" + QuarterMonthUtils.formatMoney(schedule.getAnnualTotal()));

        if (schedule.getNotes() != null && schedule.getNotes().weatherAvoidanceApplied()) {
            lines.add("");
            lines.add("Load Bank Testing included - winter months avoided where possible");
        }
        return String.join("\n", lines);
    }
}
