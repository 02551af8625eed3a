package io.github.riemr.maintenance.domain.model;

import java.util.Set;
import java.util.stream.Collectors;

import io.github.riemr.maintenance.util.ServiceCodes;

/**
 * 軽作業サービス（secondary）を主サービスの訪問に同乗させる条件。
 * 主サービスが heavy でなく、ユニット容量が {@code maxKw} 以下の場合のみ同乗可能。
 */
public record CouplingRule(String secondaryCode, Set<String> primaryCodes, double maxKw) {

    public CouplingRule {
        secondaryCode = ServiceCodes.normalize(secondaryCode);
        primaryCodes = primaryCodes.stream()
                .map(ServiceCodes::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isPrimary(String serviceCode) {
        return primaryCodes.contains(ServiceCodes.normalize(serviceCode));
    }
}
