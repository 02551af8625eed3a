package io.github.riemr.maintenance.util;

import java.util.Locale;

public final class ServiceCodes {
    public static final String INSPECTION = "A";
    public static final String OIL_FILTER = "B";
    public static final String COOLANT = "C";
    public static final String FLUID_ANALYSIS = "D";
    public static final String LOAD_BANK = "E";
    public static final String TRANSFER_SWITCH = "I";
    public static final String CUSTOM = "CUSTOM";

    private ServiceCodes() {
    }

    public static String normalize(String code) {
        if (code == null) return null;
        String upper = code.trim().toUpperCase(Locale.ROOT);
        return upper.isEmpty() ? null : upper;
    }
}
