package com.openforge.memoria.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Recovery pass policy, bound from "memoria.recovery".
 *
 *   interval                   — delay between periodic passes
 *   stale-session-threshold    — active sessions older than this are failed
 *   stale-processing-threshold — periodic passes only reclaim claims older
 *                                than this (the cold-start pass reclaims all)
 *   max-sessions-per-pass      — auto-recovery cap
 *   start-delay                — pause between consecutive processor starts
 */
@ConfigurationProperties(prefix = "memoria.recovery")
public record RecoveryProperties(
        @DefaultValue("5m") Duration interval,
        @DefaultValue("6h") Duration staleSessionThreshold,
        @DefaultValue("5m") Duration staleProcessingThreshold,
        @DefaultValue("50") int maxSessionsPerPass,
        @DefaultValue("100ms") Duration startDelay
) {
}
