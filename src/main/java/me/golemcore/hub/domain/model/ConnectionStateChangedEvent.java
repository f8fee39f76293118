package me.golemcore.hub.domain.model;

/**
 * Event published by the broker whenever a connection changes state. Consumed
 * by the audit log.
 *
 * @since 1.0
 */
public record ConnectionStateChangedEvent(String connectionId,String uri,ConnectionState from,ConnectionState to,String reason){}
