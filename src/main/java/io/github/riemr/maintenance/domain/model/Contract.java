package io.github.riemr.maintenance.domain.model;

import java.time.LocalDate;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Contract {
    LocalDate startDate; // null の場合は当日扱い
    int crewSize;
    double hoursPerTechnician;
    String weatherProfileKey;

    public double getMaxDailyHours() {
        return crewSize * hoursPerTechnician;
    }
}
