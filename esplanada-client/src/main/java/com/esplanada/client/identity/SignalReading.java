package com.esplanada.client.identity;

/**
 * Outcome of a single signal collector.
 */
public record SignalReading(String name, String value, boolean ok, String failureReason) {

    public static SignalReading ok(String name, String value) {
        return new SignalReading(name, value, true, null);
    }

    public static SignalReading failed(String name, String reason) {
        return new SignalReading(name, null, false, reason);
    }
}
