package io.github.riemr.maintenance.config;

import java.util.List;
import java.util.Map;
import java.util.Set;

import io.github.riemr.maintenance.domain.model.CapacityBracket;
import io.github.riemr.maintenance.domain.model.CouplingRule;
import io.github.riemr.maintenance.domain.model.LaborHourTable;
import io.github.riemr.maintenance.domain.model.ServiceCatalog;
import io.github.riemr.maintenance.domain.model.ServiceDefinition;
import io.github.riemr.maintenance.domain.model.WeatherProfile;
import io.github.riemr.maintenance.domain.model.WeatherProfileRegistry;
import io.github.riemr.maintenance.util.ServiceCodes;

/**
 * 標準の参照表。Bean 定義とテストの双方から利用する。
 */
public final class DefaultSchedulingTables {

    public static final String DEFAULT_PROFILE = "DEFAULT";
    public static final String SACRAMENTO_PROFILE = "SACRAMENTO_CA";

    private DefaultSchedulingTables() {}

    public static List<CapacityBracket> capacityBrackets() {
        return List.of(
                new CapacityBracket("2-14", 2, 14),
                new CapacityBracket("15-30", 15, 30),
                new CapacityBracket("35-150", 35, 150),
                new CapacityBracket("151-250", 151, 250),
                new CapacityBracket("251-400", 251, 400),
                new CapacityBracket("401-500", 401, 500),
                new CapacityBracket("501-670", 501, 670),
                new CapacityBracket("671-1050", 671, 1050),
                new CapacityBracket("1051-1500", 1051, 1500),
                new CapacityBracket("1501-2050", 1501, 2050));
    }

    public static LaborHourTable laborHourTable() {
        return new LaborHourTable(
                capacityBrackets(),
                Map.of(
                        ServiceCodes.INSPECTION, List.of(1.0, 1.0, 2.0, 2.0, 2.5, 2.5, 3.0, 3.0, 4.0, 4.0),
                        ServiceCodes.OIL_FILTER, List.of(1.0, 1.0, 2.0, 2.0, 4.0, 6.0, 8.0, 12.0, 16.0, 16.0),
                        ServiceCodes.COOLANT, List.of(2.0, 2.0, 2.0, 3.0, 3.0, 4.0, 4.0, 6.0, 6.0, 8.0),
                        ServiceCodes.LOAD_BANK, List.of(3.0, 3.0, 3.0, 4.0, 6.0, 6.0, 8.0, 8.0, 8.0, 12.0),
                        ServiceCodes.TRANSFER_SWITCH, List.of(2.0, 2.0, 3.0, 3.0, 4.0, 4.0, 6.0, 6.0, 6.0, 6.0)),
                // 流体分析はラボのみ、現地作業なし
                Map.of(ServiceCodes.FLUID_ANALYSIS, 0.0));
    }

    public static ServiceCatalog serviceCatalog() {
        return new ServiceCatalog(List.of(
                service(ServiceCodes.INSPECTION, "Comprehensive Inspection", 4, false),
                service(ServiceCodes.OIL_FILTER, "Oil & Filter Service", 1, false),
                service(ServiceCodes.COOLANT, "Coolant Service", 1, false),
                service(ServiceCodes.FLUID_ANALYSIS, "Fluid Analysis", 1, false),
                service(ServiceCodes.LOAD_BANK, "Load Bank Testing", 1, true),
                service("F", "Diesel Tune-Up", 1, false),
                service("G", "Gas Tune-Up", 1, false),
                service("H", "Electrical Testing", 1, false),
                service(ServiceCodes.TRANSFER_SWITCH, "Transfer Switch Service", 1, false),
                service("J", "Thermal Imaging", 1, false),
                service("K", "Custom Service Package", 1, false),
                service(ServiceCodes.CUSTOM, "Custom Service", 1, false)));
    }

    public static WeatherProfileRegistry weatherProfiles(String defaultKey) {
        return new WeatherProfileRegistry(List.of(
                new WeatherProfile(DEFAULT_PROFILE, Set.of(12, 1, 2), List.of(3, 4, 5, 6, 7, 8, 9, 10, 11)),
                new WeatherProfile(SACRAMENTO_PROFILE, Set.of(11, 12, 1, 2, 3), List.of(4, 5, 6, 7, 8, 9))),
                defaultKey);
    }

    /** 転送スイッチ点検は軽作業の B/C 訪問に同乗可能。 */
    public static CouplingRule transferSwitchCoupling(double maxKw) {
        return new CouplingRule(ServiceCodes.TRANSFER_SWITCH,
                Set.of(ServiceCodes.OIL_FILTER, ServiceCodes.COOLANT), maxKw);
    }

    private static ServiceDefinition service(String code, String name, int frequency, boolean weatherSensitive) {
        return ServiceDefinition.builder()
                .code(code)
                .name(name)
                .defaultFrequency(frequency)
                .weatherSensitive(weatherSensitive)
                .build();
    }
}
