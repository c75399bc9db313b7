package com.di.fleetnova.source;

/**
 * Resources offered by the fleet data API, with their path relative to the base URL.
 */
public enum ResourceKind {

    FLEET("fleet", false),
    SIGNALS("fleet/{imo}/signals", true),
    TIMESERIES("fleet/{imo}/timeseries", true);

    private final String pathTemplate;
    private final boolean perVessel;

    ResourceKind(String pathTemplate, boolean perVessel) {
        this.pathTemplate = pathTemplate;
        this.perVessel = perVessel;
    }

    public String getPathTemplate() {
        return pathTemplate;
    }

    public boolean isPerVessel() {
        return perVessel;
    }

    /** Logical name of the raw snapshot / table, e.g. {@code Timeseries_9876543}. */
    public String artifactName(String vesselId) {
        String base = name().charAt(0) + name().substring(1).toLowerCase();
        return perVessel ? base + "_" + vesselId : base;
    }
}
