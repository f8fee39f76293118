package me.golemcore.hub.domain.model;

/**
 * Event published when the council reaches a verdict on a proposal.
 *
 * @since 1.0
 */
public record CouncilVerdictEvent(String sessionId,CouncilVerdict verdict){}
