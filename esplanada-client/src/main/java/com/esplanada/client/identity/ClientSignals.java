package com.esplanada.client.identity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw weak signals reported by a client browser.
 * Every field is optional; collectors skip what is missing.
 *
 * @param platform        navigator platform string
 * @param language        preferred language tag
 * @param timezone        IANA timezone name
 * @param screenWidth     screen width in CSS pixels
 * @param screenHeight    screen height in CSS pixels
 * @param colorDepth      screen colour depth
 * @param pixelRatio      device pixel ratio
 * @param renderingSample output of the offscreen 2D draw (data URL)
 * @param audioSamples    frequency-analysis samples from the audio pipeline
 * @param userAgent       client user agent string
 * @param observedAt      when the client collected the signals
 */
public record ClientSignals(
        String platform,
        String language,
        String timezone,
        Integer screenWidth,
        Integer screenHeight,
        Integer colorDepth,
        Double pixelRatio,
        String renderingSample,
        List<Double> audioSamples,
        String userAgent,
        Instant observedAt
) {
    public ClientSignals {
        // a null sample is a failed analysis bin, not a missing signal
        audioSamples = audioSamples != null ? Collections.unmodifiableList(new ArrayList<>(audioSamples)) : List.of();
    }

    public boolean hasScreenGeometry() {
        return screenWidth != null && screenHeight != null;
    }

    public String screenSize() {
        return hasScreenGeometry() ? screenWidth + "x" + screenHeight : null;
    }
}
