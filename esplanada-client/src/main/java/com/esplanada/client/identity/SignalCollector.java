package com.esplanada.client.identity;

/**
 * A best-effort source of one identity signal.
 * Implementations must not throw for unsupported or missing input; they report a failed reading.
 */
public interface SignalCollector {

    /**
     * Stable collector name, also used as the ordering key in the digest input.
     */
    String name();

    /**
     * Reads the signal from the reported client data.
     *
     * @param signals raw client signals
     * @return reading with {@code ok == false} when the signal is unavailable
     */
    SignalReading collect(ClientSignals signals);
}
