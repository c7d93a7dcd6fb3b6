package com.esplanada.client.identity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Audio-pipeline fingerprint: digest over the first samples of the oscillator analysis.
 */
public class AudioSignalCollector implements SignalCollector {

    public static final String NAME = "audio";

    private static final int SAMPLE_COUNT = 100;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SignalReading collect(ClientSignals signals) {
        if (signals == null || signals.audioSamples().isEmpty()) {
            return SignalReading.failed(NAME, "audio context not supported");
        }
        List<Double> samples = signals.audioSamples();
        String joined = samples.stream()
                .limit(SAMPLE_COUNT)
                .map(sample -> sample == null ? "NaN" : Double.toString(sample))
                .collect(Collectors.joining(","));
        return SignalReading.ok(NAME, Digests.sha256(joined));
    }
}
