package io.github.riemr.maintenance.presentation.controller;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.riemr.maintenance.application.dto.LaborHourLookupDto;
import io.github.riemr.maintenance.application.dto.Schedule;
import io.github.riemr.maintenance.application.dto.ScheduleExportRow;
import io.github.riemr.maintenance.application.dto.ScheduleRequest;
import io.github.riemr.maintenance.application.service.MaintenanceScheduleService;
import io.github.riemr.maintenance.application.service.ScheduleExportService;
import io.github.riemr.maintenance.domain.model.ServiceDefinition;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/maintenance-schedule")
@RequiredArgsConstructor
public class MaintenanceScheduleController {

    private final MaintenanceScheduleService scheduleService;
    private final ScheduleExportService exportService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Schedule generate(@Valid @RequestBody ScheduleRequest request) {
        return scheduleService.generate(request);
    }

    @PostMapping(path = "/export", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ScheduleExportRow> export(@Valid @RequestBody ScheduleRequest request) {
        return exportService.toRows(scheduleService.generate(request));
    }

    @PostMapping(path = "/summary-text", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE + ";charset=UTF-8")
    public String summaryText(@Valid @RequestBody ScheduleRequest request) {
        return exportService.toText(scheduleService.generate(request));
    }

    @GetMapping(path = "/labor-hours", produces = MediaType.APPLICATION_JSON_VALUE)
    public LaborHourLookupDto laborHours(@RequestParam("service") String service,
                                         @RequestParam("kw") double kw) {
        return scheduleService.lookupLaborHours(service, kw);
    }

    @GetMapping(path = "/services", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ServiceDefinition> services() {
        return scheduleService.listServices();
    }
}
