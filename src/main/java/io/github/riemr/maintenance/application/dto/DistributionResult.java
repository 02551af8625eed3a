package io.github.riemr.maintenance.application.dto;

import java.util.List;
import java.util.Map;

import io.github.riemr.maintenance.domain.model.ServiceAssignment;

/**
 * 四半期番号 → その四半期に実施する契約サービスの一覧、および配分時の警告。
 */
public record DistributionResult(Map<Integer, List<ServiceAssignment>> placements,
                                 List<ScheduleWarning> warnings) {

    public List<ServiceAssignment> placementsFor(int quarterIndex) {
        return placements.getOrDefault(quarterIndex, List.of());
    }
}
