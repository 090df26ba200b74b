package com.questrail.hamgateway.server;

/**
 * Lifecycle states of a {@link ServerLifecycle}.
 *
 * <p>Transitions: {@code STOPPED -> RUNNING} on start, {@code RUNNING -> STOPPED}
 * on stop, any state {@code -> DISPOSED} on close. {@code DISPOSED} is terminal.</p>
 */
public enum LifecycleState
{
    STOPPED,
    RUNNING,
    DISPOSED
}
