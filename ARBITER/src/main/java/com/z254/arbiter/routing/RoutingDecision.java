package com.z254.arbiter.routing;

/**
 * Version chosen to serve one prediction. {@code versionId} is null when no
 * version is available for the requested type.
 */
public record RoutingDecision(String versionId, String abTestId, Arm arm) {

    public enum Arm {
        CHAMPION,
        CANDIDATE
    }

    public static RoutingDecision direct(String versionId) {
        return new RoutingDecision(versionId, null, null);
    }

    public static RoutingDecision none() {
        return new RoutingDecision(null, null, null);
    }

    public boolean usedAbTest() {
        return abTestId != null;
    }

    public boolean hasVersion() {
        return versionId != null;
    }
}
