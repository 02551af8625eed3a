package io.github.riemr.maintenance.application.dto;

public record ScheduleNotes(boolean weatherAvoidanceApplied, boolean schedulingFlexible, String billingBasis) {

    public static ScheduleNotes of(boolean weatherAvoidanceApplied) {
        return new ScheduleNotes(weatherAvoidanceApplied, true, "work completed");
    }
}
