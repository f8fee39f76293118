package me.golemcore.hub.domain.model;

/**
 * Event published on every autonomy loop state transition.
 *
 * @since 1.0
 */
public record TaskTransitionEvent(String sessionId,String taskId,LoopTransition transition){}
