package com.questrail.hamgateway.message;

/**
 * Semantic minimum-content check for a decoded message.
 */
@FunctionalInterface
public interface MessageValidator<T>
{
    boolean isValid(T message);
}
