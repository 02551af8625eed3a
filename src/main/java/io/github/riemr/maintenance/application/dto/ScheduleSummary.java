package io.github.riemr.maintenance.application.dto;

import java.math.BigDecimal;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScheduleSummary {
    int totalDays;
    double totalHours;
    double averageHoursPerDay;
    Map<String, Integer> servicesPerformed;
    Map<String, Integer> visitsPerQuarter;
    BigDecimal annualTotal;
}
