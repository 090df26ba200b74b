package com.questrail.hamgateway.protocol.n1mm;

import com.questrail.hamgateway.protocol.n1mm.schema.AppInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactDelete;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactReplace;
import com.questrail.hamgateway.protocol.n1mm.schema.DynamicResults;
import com.questrail.hamgateway.protocol.n1mm.schema.LookupInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.N1mmMessage;
import com.questrail.hamgateway.protocol.n1mm.schema.RadioInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.Spot;
import com.questrail.hamgateway.server.CancellationSignal;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * N1mmMessageType
 * =============================================================================
 * The closed set of N1MM message kinds: wire tag, payload class and the
 * {@link N1mmMessageHandler} operation each kind is delivered to.
 *
 * <p>Every constant implements {@link #dispatch}, so adding a kind without a
 * handler operation does not compile.</p>
 */
public enum N1mmMessageType
{
    APP_INFO("appinfo", AppInfo.class) {
        @Override
        void deliver(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation)
        {
            handler.handleAppInfo((AppInfo) message, sender, cancellation);
        }
    },
    CONTACT_INFO("contactinfo", ContactInfo.class) {
        @Override
        void deliver(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation)
        {
            handler.handleContactInfo((ContactInfo) message, sender, cancellation);
        }
    },
    CONTACT_REPLACE("contactreplace", ContactReplace.class) {
        @Override
        void deliver(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation)
        {
            handler.handleContactReplace((ContactReplace) message, sender, cancellation);
        }
    },
    CONTACT_DELETE("contactdelete", ContactDelete.class) {
        @Override
        void deliver(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation)
        {
            handler.handleContactDelete((ContactDelete) message, sender, cancellation);
        }
    },
    LOOKUP_INFO("lookupinfo", LookupInfo.class) {
        @Override
        void deliver(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation)
        {
            handler.handleLookupInfo((LookupInfo) message, sender, cancellation);
        }
    },
    SPOT("spot", Spot.class) {
        @Override
        void deliver(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation)
        {
            handler.handleSpot((Spot) message, sender, cancellation);
        }
    },
    DYNAMIC_RESULTS("dynamicresults", DynamicResults.class) {
        @Override
        void deliver(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation)
        {
            handler.handleDynamicResults((DynamicResults) message, sender, cancellation);
        }
    },
    RADIO_INFO("radioinfo", RadioInfo.class) {
        @Override
        void deliver(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation)
        {
            handler.handleRadioInfo((RadioInfo) message, sender, cancellation);
        }
    };

    private static final Map<Class<?>, N1mmMessageType> BY_PAYLOAD_TYPE = new HashMap<>();

    static {
        for (N1mmMessageType type : values()) {
            BY_PAYLOAD_TYPE.put(type.payloadType, type);
        }
    }

    private final String tag;
    private final Class<? extends N1mmMessage> payloadType;

    N1mmMessageType(String tag, Class<? extends N1mmMessage> payloadType)
    {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    /**
     * Lower-case root tag of this kind on the wire.
     */
    public String tag()
    {
        return tag;
    }

    public Class<? extends N1mmMessage> payloadType()
    {
        return payloadType;
    }

    /**
     * Finds the kind whose payload class is exactly {@code type}.
     */
    public static Optional<N1mmMessageType> forPayloadType(Class<?> type)
    {
        return Optional.ofNullable(BY_PAYLOAD_TYPE.get(type));
    }

    /**
     * Delivers {@code message} to this kind's handler operation.
     *
     * @throws IllegalArgumentException if {@code message} is not exactly of
     *                                  this kind's payload class
     */
    public void dispatch(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation)
    {
        if (message.getClass() != payloadType) {
            throw new IllegalArgumentException(
                name() + " cannot dispatch " + message.getClass().getSimpleName());
        }
        deliver(handler, message, sender, cancellation);
    }

    abstract void deliver(N1mmMessageHandler handler, N1mmMessage message, InetSocketAddress sender, CancellationSignal cancellation);
}
