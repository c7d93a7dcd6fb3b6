package com.esplanada.api.broadcast;

import com.esplanada.core.domain.SecurityEvent;

/**
 * Audit subscriber for recorded security events.
 */
@FunctionalInterface
public interface SecurityEventListener {

    void onSecurityEvent(SecurityEvent event);
}
