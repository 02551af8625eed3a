package io.github.riemr.maintenance.application.dto;

public record LaborHourLookupDto(String service, double kw, String bracket, double hours, boolean heavy) {
}
