package com.esplanada.client.identity;

import java.util.StringJoiner;

/**
 * Navigator-like metadata: platform, language, timezone and screen geometry.
 * Succeeds when at least one of the fields is present.
 */
public class NavigatorSignalCollector implements SignalCollector {

    public static final String NAME = "navigator";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SignalReading collect(ClientSignals signals) {
        if (signals == null) {
            return SignalReading.failed(NAME, "no signals reported");
        }
        boolean any = isPresent(signals.platform())
                || isPresent(signals.language())
                || isPresent(signals.timezone())
                || signals.hasScreenGeometry();
        if (!any) {
            return SignalReading.failed(NAME, "navigator metadata unavailable");
        }

        StringJoiner joiner = new StringJoiner("|");
        joiner.add("platform=" + nullToEmpty(signals.platform()));
        joiner.add("language=" + nullToEmpty(signals.language()));
        joiner.add("timezone=" + nullToEmpty(signals.timezone()));
        joiner.add("screen=" + nullToEmpty(signals.screenSize()));
        joiner.add("depth=" + (signals.colorDepth() != null ? signals.colorDepth() : ""));
        joiner.add("ratio=" + (signals.pixelRatio() != null ? signals.pixelRatio() : ""));
        return SignalReading.ok(NAME, joiner.toString());
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
