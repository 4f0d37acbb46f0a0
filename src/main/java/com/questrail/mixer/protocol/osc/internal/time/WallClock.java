package com.questrail.mixer.protocol.osc.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used only to timestamp observability events. It may jump
 * (NTP, manual changes) and MUST NOT drive query deadlines or keepalive cadence.
 */
public interface WallClock
{
    Instant now();
}
