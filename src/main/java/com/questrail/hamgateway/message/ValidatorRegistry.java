package com.questrail.hamgateway.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ValidatorRegistry
 * =============================================================================
 * Immutable mapping from message type to its validator.
 *
 * <p>Lookups use the exact runtime class of the message: a validator
 * registered for a type does not apply to its subclasses. A type with no
 * registered validator is always valid.</p>
 */
public final class ValidatorRegistry
{
    private static final ValidatorRegistry EMPTY = new ValidatorRegistry(Collections.emptyMap());

    private final Map<Class<?>, MessageValidator<?>> validators;

    private ValidatorRegistry(Map<Class<?>, MessageValidator<?>> validators)
    {
        this.validators = validators;
    }

    public static ValidatorRegistry empty()
    {
        return EMPTY;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Runs the validator registered for {@code message}'s exact class.
     *
     * @return {@code true} if valid or if no validator is registered
     */
    public boolean isValid(Object message)
    {
        Objects.requireNonNull(message, "message");

        @SuppressWarnings("unchecked")
        MessageValidator<Object> validator = (MessageValidator<Object>) validators.get(message.getClass());
        return validator == null || validator.isValid(message);
    }

    public boolean hasValidator(Class<?> type)
    {
        return validators.containsKey(type);
    }

    public static final class Builder
    {
        private final Map<Class<?>, MessageValidator<?>> validators = new LinkedHashMap<>();

        private Builder() {}

        public <T> Builder register(Class<T> type, MessageValidator<? super T> validator)
        {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(validator, "validator");
            validators.put(type, validator);
            return this;
        }

        public ValidatorRegistry build()
        {
            return new ValidatorRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(validators)));
        }
    }
}
