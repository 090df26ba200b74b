package com.questrail.hamgateway.protocol.n1mm;

import com.questrail.hamgateway.protocol.n1mm.schema.N1mmMessage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * TagRegistry
 * =============================================================================
 * Immutable mapping from lower-case root tag to the payload class it decodes into.
 *
 * <p>The default registry holds one entry per {@link N1mmMessageType}. A
 * builder may add tags or remap existing ones before the router is created;
 * a registry never changes afterwards. A tag mapped to a class outside
 * {@link N1mmMessageType} decodes but is dropped as unhandled.</p>
 */
public final class TagRegistry
{
    private static final TagRegistry DEFAULTS = builder().withDefaults().build();

    private final Map<String, Class<? extends N1mmMessage>> types;

    private TagRegistry(Map<String, Class<? extends N1mmMessage>> types)
    {
        this.types = types;
    }

    public static TagRegistry defaults()
    {
        return DEFAULTS;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Resolves a root tag, case-insensitively.
     */
    public Optional<Class<? extends N1mmMessage>> resolve(String tag)
    {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(tag.toLowerCase(Locale.ROOT)));
    }

    public Set<String> tags()
    {
        return types.keySet();
    }

    public static final class Builder
    {
        private final Map<String, Class<? extends N1mmMessage>> types = new LinkedHashMap<>();

        private Builder() {}

        public Builder withDefaults()
        {
            for (N1mmMessageType type : N1mmMessageType.values()) {
                types.put(type.tag(), type.payloadType());
            }
            return this;
        }

        /**
         * Maps {@code tag} to {@code type}, replacing any existing mapping.
         */
        public Builder register(String tag, Class<? extends N1mmMessage> type)
        {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(type, "type");
            if (tag.isBlank()) {
                throw new IllegalArgumentException("tag must not be blank");
            }
            types.put(tag.toLowerCase(Locale.ROOT), type);
            return this;
        }

        public TagRegistry build()
        {
            return new TagRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(types)));
        }
    }
}
