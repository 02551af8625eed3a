package io.github.riemr.maintenance.application.service;

import static io.github.riemr.maintenance.application.service.SchedulingFixtures.assignment;
import static io.github.riemr.maintenance.application.service.SchedulingFixtures.unit;
import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.riemr.maintenance.application.dto.QuarterSchedule;
import io.github.riemr.maintenance.application.dto.Visit;
import io.github.riemr.maintenance.application.dto.VisitLineItem;
import io.github.riemr.maintenance.domain.model.GeneratorUnit;
import io.github.riemr.maintenance.domain.model.ServiceAssignment;

class CostAggregationServiceTest {

    private final CostAggregationService service = new CostAggregationService();

    @Test
    void applyCosts_sumsVisitAndQuarterTotals() {
        GeneratorUnit u = unit("U1", 200);
        QuarterSchedule q1 = quarter(1, visit(assignment(u, "A", 4, "250"), assignment(u, "B", 2, "600")));
        QuarterSchedule q2 = quarter(2, visit(assignment(u, "A", 4, "250")), visit(assignment(u, "C", 1, "125.50")));

        service.applyCosts(List.of(q1, q2));

        assertThat(q1.getVisits().get(0).getTotalCost()).isEqualByComparingTo("850");
        assertThat(q1.getTotal()).isEqualByComparingTo("850");
        assertThat(q2.getTotal()).isEqualByComparingTo("375.50");
        assertThat(service.annualTotal(List.of(q1, q2))).isEqualByComparingTo("1225.50");
    }

    @Test
    void missingCost_treatedAsZero_andOccurrenceKept() {
        GeneratorUnit u = unit("U1", 200);
        QuarterSchedule q1 = quarter(1, visit(assignment(u, "A", 4, "250"), assignment(u, "D", 1, null)));

        service.applyCosts(List.of(q1));

        List<VisitLineItem> items = q1.getVisits().get(0).getItems();
        assertThat(items).hasSize(2);
        assertThat(items.get(1).getCost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(q1.getTotal()).isEqualByComparingTo("250");
    }

    @Test
    void contractedAnnualTotal_isCostTimesFrequency() {
        GeneratorUnit u = unit("U1", 200);
        List<ServiceAssignment> assignments = List.of(
                assignment(u, "A", 4, "250"),
                assignment(u, "B", 2, "600"),
                assignment(u, "C", 7, "100"), // 不明な回数は年1回
                assignment(u, "D", 1, null));

        assertThat(service.contractedAnnualTotal(assignments)).isEqualByComparingTo("2300");
    }

    private static QuarterSchedule quarter(int index, Visit... visits) {
        return QuarterSchedule.builder()
                .index(index)
                .label("Q" + index)
                .visits(List.of(visits))
                .build();
    }

    private static Visit visit(ServiceAssignment... assignments) {
        Visit visit = new Visit();
        for (ServiceAssignment a : assignments) {
            visit.addItem(VisitLineItem.builder()
                    .unitId(a.getUnit().getId())
                    .serviceCode(a.getServiceCode())
                    .frequency(a.getEffectiveFrequency())
                    .source(a)
                    .build());
        }
        return visit;
    }
}
