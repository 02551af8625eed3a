package io.github.riemr.maintenance.application.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScheduleWarning {
    Integer quarter;       // 1..4。年間全体に関するものは null
    String quarterLabel;
    WarningSeverity severity;
    String message;
    String recommendation;
}
