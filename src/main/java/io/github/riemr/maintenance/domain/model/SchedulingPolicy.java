package io.github.riemr.maintenance.domain.model;

import java.util.List;
import java.util.Optional;

import io.github.riemr.maintenance.util.ServiceCodes;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * スケジューラの調整可能なポリシー値。
 */
@Value
@Builder
public class SchedulingPolicy {
    double heavyThresholdHours;
    double concentrationFactor;
    int defaultCrewSize;
    double defaultHoursPerTechnician;
    @Singular
    List<CouplingRule> couplingRules;

    public Optional<CouplingRule> couplingRuleFor(String secondaryCode) {
        String code = ServiceCodes.normalize(secondaryCode);
        return couplingRules.stream()
                .filter(r -> r.secondaryCode().equals(code))
                .findFirst();
    }
}
