package io.github.riemr.maintenance.application.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * 年間保守スケジュール。PDF 生成・CRM 連携がそのまま参照する。
 */
@Value
@Builder
public class Schedule {
    LocalDate startDate;
    int firstServiceMonth;
    String weatherProfile;
    double maxDailyHours;
    List<QuarterSchedule> quarters;
    BigDecimal annualTotal;
    List<ScheduleWarning> warnings;
    ScheduleSummary summary;
    ScheduleNotes notes;
}
