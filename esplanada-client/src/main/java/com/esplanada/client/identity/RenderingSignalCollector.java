package com.esplanada.client.identity;

/**
 * Rendering fingerprint: digest of the offscreen 2D draw output.
 */
public class RenderingSignalCollector implements SignalCollector {

    public static final String NAME = "rendering";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SignalReading collect(ClientSignals signals) {
        if (signals == null || signals.renderingSample() == null || signals.renderingSample().isBlank()) {
            return SignalReading.failed(NAME, "canvas rendering not supported");
        }
        return SignalReading.ok(NAME, Digests.sha256(signals.renderingSample()));
    }
}
