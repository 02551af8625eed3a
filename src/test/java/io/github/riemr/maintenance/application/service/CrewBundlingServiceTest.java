package io.github.riemr.maintenance.application.service;

import static io.github.riemr.maintenance.application.service.SchedulingFixtures.assignment;
import static io.github.riemr.maintenance.application.service.SchedulingFixtures.unit;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.riemr.maintenance.application.dto.QuarterAnchor;
import io.github.riemr.maintenance.application.dto.Visit;
import io.github.riemr.maintenance.application.dto.VisitLineItem;
import io.github.riemr.maintenance.config.DefaultSchedulingTables;
import io.github.riemr.maintenance.domain.model.GeneratorUnit;
import io.github.riemr.maintenance.domain.model.ServiceAssignment;
import io.github.riemr.maintenance.domain.model.WeatherProfile;

class CrewBundlingServiceTest {

    private static final QuarterAnchor Q1 = new QuarterAnchor(1, "NOV Qtr 1", 11, LocalDate.of(2025, 11, 1));
    private static final WeatherProfile PROFILE = DefaultSchedulingTables.weatherProfiles("DEFAULT").getDefaultProfile();
    private static final double CREW_OF_THREE = 18;

    private final CrewBundlingService bundler = SchedulingFixtures.bundler(SchedulingFixtures.policy());

    @Test
    void packsLightWork_upToDailyCapacity() {
        List<ServiceAssignment> occurrences = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            occurrences.add(assignment(unit("U" + i, 200), "A", 4, "250")); // 2h each
        }

        List<Visit> visits = bundler.bundle(Q1, occurrences, CREW_OF_THREE, PROFILE);

        assertThat(visits).hasSize(2);
        assertThat(visits.get(0).getItems()).hasSize(9);
        assertThat(visits.get(0).getTotalHours()).isEqualTo(18.0);
        assertThat(visits.get(1).getItems()).hasSize(1);
        assertThat(visits).extracting(Visit::getDay).containsExactly(1, 2);
        assertThat(visits).extracting(Visit::getDate)
                .containsExactly(LocalDate.of(2025, 11, 1), LocalDate.of(2025, 11, 2));
        assertThat(visits).noneMatch(Visit::isOverCapacity);
    }

    @Test
    void higherFrequencyWork_isPackedFirst() {
        GeneratorUnit u = unit("U1", 200);
        ServiceAssignment annual = assignment(u, "C", 1, "400");
        ServiceAssignment quarterly = assignment(u, "A", 4, "250");

        List<Visit> visits = bundler.bundle(Q1, List.of(annual, quarterly), CREW_OF_THREE, PROFILE);

        assertThat(visits).hasSize(1);
        assertThat(visits.get(0).getItems()).extracting(VisitLineItem::getServiceCode).containsExactly("A", "C");
    }

    @Test
    void heavyServices_getTheirOwnVisit() {
        GeneratorUnit u = unit("U1", 450);
        List<ServiceAssignment> occurrences = List.of(
                assignment(u, "A", 4, "250"),  // 2.5h
                assignment(u, "B", 1, "900"),  // 6h heavy
                assignment(u, "E", 1, "1200")); // 6h heavy, 天候依存

        List<Visit> visits = bundler.bundle(Q1, occurrences, CREW_OF_THREE, PROFILE);

        assertThat(visits).hasSize(3);
        for (Visit visit : visits) {
            assertThat(visit.getItems().stream().filter(VisitLineItem::isHeavy).count()).isLessThanOrEqualTo(1);
        }
        assertThat(visits.get(1).getItems()).extracting(VisitLineItem::getServiceCode).containsExactly("B");
        Visit loadBank = visits.get(2);
        assertThat(loadBank.getItems()).extracting(VisitLineItem::getServiceCode).containsExactly("E");
        assertThat(loadBank.getDate()).isNull();
        assertThat(loadBank.getNotes()).anyMatch(n -> n.startsWith("Dry weather required"));
    }

    @Test
    void oversizedOccurrence_keptInFlaggedVisit() {
        GeneratorUnit big = unit("BIG", 1600);
        List<ServiceAssignment> occurrences = List.of(
                assignment(big, "A", 4, "300"),  // 4h
                assignment(big, "B", 1, "2500")); // 16h > 6h

        List<Visit> visits = bundler.bundle(Q1, occurrences, 6, PROFILE);

        assertThat(visits).hasSize(2);
        assertThat(visits.get(0).isOverCapacity()).isFalse();
        Visit oversized = visits.get(1);
        assertThat(oversized.isOverCapacity()).isTrue();
        assertThat(oversized.getItems()).extracting(VisitLineItem::getServiceCode).containsExactly("B");
        assertThat(oversized.getNotes()).anyMatch(n -> n.contains("Exceeds daily crew capacity (16 of 6 hours)"));
    }

    @Test
    void visitsNeverExceedCapacity_exceptSingleOversizedItem() {
        List<ServiceAssignment> occurrences = new ArrayList<>();
        double[] sizes = {20, 120, 300, 450, 600, 900, 1200, 1800};
        String[] codes = {"A", "B", "C", "D", "E", "I"};
        for (int i = 0; i < sizes.length; i++) {
            for (String code : codes) {
                occurrences.add(assignment(unit("U" + i, sizes[i]), code, (i % 3 == 0) ? 4 : 1, "100"));
            }
        }

        List<Visit> visits = bundler.bundle(Q1, occurrences, 12, PROFILE);

        int itemCount = 0;
        for (Visit visit : visits) {
            itemCount += visit.getItems().size();
            if (visit.getTotalHours() > 12) {
                assertThat(visit.isOverCapacity()).isTrue();
                assertThat(visit.getItems()).hasSize(1);
            }
        }
        assertThat(itemCount).isEqualTo(occurrences.size());
    }

    @Test
    void transferSwitch_coupledWithLightPrimaryOnSameUnit() {
        GeneratorUnit u = unit("U1", 300); // B=4h, I=4h
        List<ServiceAssignment> occurrences = List.of(
                assignment(u, "I", 1, "350"),
                assignment(u, "B", 2, "600"));

        List<Visit> visits = bundler.bundle(Q1, occurrences, CREW_OF_THREE, PROFILE);

        assertThat(visits).hasSize(1);
        assertThat(visits.get(0).getItems()).extracting(VisitLineItem::getServiceCode).containsExactly("B", "I");
        assertThat(visits.get(0).getTotalHours()).isEqualTo(8.0);
        assertThat(visits.get(0).getNotes()).contains("Lightweight unit - coupled B and I services");
    }

    @Test
    void transferSwitch_coupled_whenCodesAreLowerCase() {
        GeneratorUnit u = unit("U1", 300);
        List<ServiceAssignment> occurrences = List.of(
                assignment(u, " i", 1, "350"),
                assignment(u, "b ", 2, "600"));

        List<Visit> visits = bundler.bundle(Q1, occurrences, CREW_OF_THREE, PROFILE);

        assertThat(visits).hasSize(1);
        assertThat(visits.get(0).getItems()).extracting(VisitLineItem::getServiceCode).containsExactly("B", "I");
        assertThat(visits.get(0).getNotes()).contains("Lightweight unit - coupled B and I services");
    }

    @Test
    void transferSwitch_notCoupled_whenPrimaryIsHeavy() {
        GeneratorUnit u = unit("U1", 450); // B=6h heavy, I=4h
        List<ServiceAssignment> occurrences = List.of(
                assignment(u, "B", 1, "900"),
                assignment(u, "I", 1, "350"));

        List<Visit> visits = bundler.bundle(Q1, occurrences, CREW_OF_THREE, PROFILE);

        assertThat(visits).hasSize(2);
        assertThat(visits.get(1).getItems()).extracting(VisitLineItem::getServiceCode).containsExactly("I");
    }

    @Test
    void transferSwitch_capacityCeiling_isConfigurable() {
        CrewBundlingService strict = SchedulingFixtures.bundler(SchedulingFixtures.policy(250));
        GeneratorUnit u = unit("U1", 300);
        List<ServiceAssignment> occurrences = List.of(
                assignment(u, "B", 1, "600"),
                assignment(u, "I", 1, "350"));

        assertThat(strict.bundle(Q1, occurrences, CREW_OF_THREE, PROFILE)).hasSize(2);
        assertThat(bundler.bundle(Q1, occurrences, CREW_OF_THREE, PROFILE)).hasSize(1);
    }

    @Test
    void transferSwitch_notCoupledWithOtherUnit() {
        List<ServiceAssignment> occurrences = List.of(
                assignment(unit("U1", 300), "B", 1, "600"),
                assignment(unit("U2", 300), "I", 1, "350"));

        List<Visit> visits = bundler.bundle(Q1, occurrences, CREW_OF_THREE, PROFILE);

        assertThat(visits).hasSize(2);
        assertThat(visits.get(1).getItems()).extracting(VisitLineItem::getUnitId).containsExactly("U2");
    }

    @Test
    void labOnlyService_addsNoHours() {
        GeneratorUnit u = unit("U1", 200);
        List<Visit> visits = bundler.bundle(Q1,
                List.of(assignment(u, "A", 4, "250"), assignment(u, "D", 1, "150")),
                CREW_OF_THREE, PROFILE);

        assertThat(visits).hasSize(1);
        assertThat(visits.get(0).getItems()).hasSize(2);
        assertThat(visits.get(0).getTotalHours()).isEqualTo(2.0);
    }

    @Test
    void emptyQuarter_producesNoVisits() {
        assertThat(bundler.bundle(Q1, List.of(), CREW_OF_THREE, PROFILE)).isEmpty();
    }
}
