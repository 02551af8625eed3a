package io.github.riemr.maintenance.application.dto;

/**
 * PDF の四半期サービス表 1 行分（訪問単位）。
 */
public record ScheduleExportRow(
    String quarter,
    int day,
    String date,
    String units,
    String services,
    double totalHours,
    String notes
) {
}
