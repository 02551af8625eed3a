package io.github.riemr.maintenance.config;

import java.time.Clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.riemr.maintenance.domain.model.LaborHourTable;
import io.github.riemr.maintenance.domain.model.SchedulingPolicy;
import io.github.riemr.maintenance.domain.model.ServiceCatalog;
import io.github.riemr.maintenance.domain.model.WeatherProfileRegistry;

@Configuration
public class SchedulingPolicyConfig {

    @Value("${maintenance.crew.size:3}")
    private int defaultCrewSize;

    @Value("${maintenance.crew.hours-per-tech:6}")
    private double defaultHoursPerTech;

    @Value("${maintenance.heavy-threshold-hours:6}")
    private double heavyThresholdHours;

    @Value("${maintenance.coupling.transfer-switch.max-kw:500}")
    private double transferSwitchMaxKw;

    @Value("${maintenance.balance.concentration-factor:1.5}")
    private double concentrationFactor;

    @Value("${maintenance.weather.default-profile:" + DefaultSchedulingTables.DEFAULT_PROFILE + "}")
    private String defaultWeatherProfile;

    @Bean
    public LaborHourTable laborHourTable() {
        return DefaultSchedulingTables.laborHourTable();
    }

    @Bean
    public ServiceCatalog serviceCatalog() {
        return DefaultSchedulingTables.serviceCatalog();
    }

    @Bean
    public WeatherProfileRegistry weatherProfileRegistry() {
        return DefaultSchedulingTables.weatherProfiles(defaultWeatherProfile);
    }

    @Bean
    public SchedulingPolicy schedulingPolicy() {
        return SchedulingPolicy.builder()
                .heavyThresholdHours(heavyThresholdHours)
                .concentrationFactor(concentrationFactor)
                .defaultCrewSize(defaultCrewSize)
                .defaultHoursPerTechnician(defaultHoursPerTech)
                .couplingRule(DefaultSchedulingTables.transferSwitchCoupling(transferSwitchMaxKw))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
