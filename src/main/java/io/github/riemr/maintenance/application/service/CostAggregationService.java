package io.github.riemr.maintenance.application.service;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Service;

import io.github.riemr.maintenance.application.dto.QuarterSchedule;
import io.github.riemr.maintenance.application.dto.Visit;
import io.github.riemr.maintenance.application.dto.VisitLineItem;
import io.github.riemr.maintenance.domain.model.ServiceAssignment;

/**
 * 訪問明細へ1回あたり費用を付与し、訪問・四半期・年間の合計を集計する。
 * 費用未設定は 0 として扱い、明細は残す。
 */
@Service
public class CostAggregationService {

    public void applyCosts(List<QuarterSchedule> quarters) {
        for (QuarterSchedule quarter : quarters) {
            BigDecimal quarterTotal = BigDecimal.ZERO;
            for (Visit visit : quarter.getVisits()) {
                BigDecimal visitTotal = BigDecimal.ZERO;
                for (VisitLineItem item : visit.getItems()) {
                    BigDecimal cost = item.getSource() != null ? item.getSource().getEffectiveCost() : BigDecimal.ZERO;
                    item.setCost(cost);
                    visitTotal = visitTotal.add(cost);
                }
                visit.setTotalCost(visitTotal);
                quarterTotal = quarterTotal.add(visitTotal);
            }
            quarter.setTotal(quarterTotal);
        }
    }

    public BigDecimal annualTotal(List<QuarterSchedule> quarters) {
        return quarters.stream()
                .map(QuarterSchedule::getTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** 契約から見た年間合計（Σ 費用 × 回数）。配分結果の検算に使う。 */
    public BigDecimal contractedAnnualTotal(List<ServiceAssignment> assignments) {
        return assignments.stream()
                .map(a -> a.getEffectiveCost().multiply(BigDecimal.valueOf(a.getEffectiveFrequency())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
