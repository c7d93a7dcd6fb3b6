package com.esplanada.api.suspicious;

import com.esplanada.core.domain.SecurityEvent.EventType;

/**
 * Allow, or flag with the heuristic that fired.
 */
public record SuspicionVerdict(boolean flagged, EventType eventType, String reason) {

    public static SuspicionVerdict allow() {
        return new SuspicionVerdict(false, null, null);
    }

    public static SuspicionVerdict flag(EventType eventType, String reason) {
        return new SuspicionVerdict(true, eventType, reason);
    }
}
