package com.questrail.hamgateway.protocol.n1mm;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.questrail.hamgateway.buffer.OwnedBuffer;
import com.questrail.hamgateway.internal.time.SystemWallClock;
import com.questrail.hamgateway.internal.time.WallClock;
import com.questrail.hamgateway.message.MessageDecodeException;
import com.questrail.hamgateway.message.MessageProcessor;
import com.questrail.hamgateway.message.ValidatorRegistry;
import com.questrail.hamgateway.observability.GatewayErrorEvent;
import com.questrail.hamgateway.observability.GatewayObservabilitySink;
import com.questrail.hamgateway.observability.MessageDroppedEvent;
import com.questrail.hamgateway.observability.NullObservabilitySink;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.N1mmMessage;
import com.questrail.hamgateway.protocol.n1mm.validation.ContactInfoMinimumContentValidator;
import com.questrail.hamgateway.server.CancellationSignal;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * N1mmMessageRouter
 * =============================================================================
 * Turns raw N1MM Logger+ payloads into handler calls.
 *
 * <h2>Pipeline</h2>
 * Each payload passes through, in order:
 * <ol>
 *   <li><b>Tag extraction</b>: the root element name, lower-cased. A payload
 *       without a well-formed root element is dropped as malformed.</li>
 *   <li><b>Type resolution</b>: the tag is looked up in the
 *       {@link TagRegistry}. Unknown tags are dropped.</li>
 *   <li><b>Decode</b>: the whole payload is bound to the resolved class with
 *       Jackson XML. Failures are dropped.</li>
 *   <li><b>Validate</b>: the validator registered for the exact class, if
 *       any, must accept the message. Rejected messages are dropped and the
 *       message is included in the report.</li>
 *   <li><b>Dispatch</b>: the {@link N1mmMessageType} of the exact class
 *       delivers the message to its handler operation. A class with no
 *       message type is dropped as unhandled.</li>
 * </ol>
 *
 * <p>The cancellation signal is only passed through to the handler. A payload
 * that reaches {@link #process} is decoded and delivered even if the signal
 * has already fired.</p>
 *
 * <h2>Failure containment</h2>
 * {@link #process} never throws. Drops are reported through
 * {@link GatewayObservabilitySink#onMessageDropped}; any other fault,
 * including one thrown by the handler, through
 * {@link GatewayObservabilitySink#onError}.
 *
 * <p>This class is thread-safe.</p>
 */
public final class N1mmMessageRouter implements MessageProcessor
{
    private final N1mmMessageHandler handler;
    private final TagRegistry tags;
    private final ValidatorRegistry validators;
    private final GatewayObservabilitySink sink;
    private final WallClock wallClock;

    private final XmlMapper mapper;
    private final RootTagReader rootTagReader;

    private N1mmMessageRouter(Builder b)
    {
        this.handler = Objects.requireNonNull(b.handler, "handler");
        this.tags = Objects.requireNonNull(b.tags, "tags");
        this.validators = Objects.requireNonNull(b.validators, "validators");
        this.sink = Objects.requireNonNull(b.sink, "sink");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");

        this.mapper = N1mmXml.newMapper();
        this.rootTagReader = new RootTagReader(mapper.getFactory().getXMLInputFactory());
    }

    public static Builder builder(N1mmMessageHandler handler)
    {
        return new Builder(handler);
    }

    /**
     * Validators applied when none are configured: minimum content for
     * {@link ContactInfo}.
     */
    public static ValidatorRegistry defaultValidators()
    {
        return ValidatorRegistry.builder()
            .register(ContactInfo.class, new ContactInfoMinimumContentValidator())
            .build();
    }

    @Override
    public void process(OwnedBuffer payload, InetSocketAddress sender, CancellationSignal cancellation)
    {
        String tag = null;
        try {
            tag = rootTagReader.readRootTag(payload.openStream());

            Optional<Class<? extends N1mmMessage>> type = tags.resolve(tag);
            if (type.isEmpty()) {
                drop(sender, MessageDroppedEvent.Reason.UNKNOWN_TAG, tag, "unknown message type");
                return;
            }

            N1mmMessage message = decode(tag, type.get(), payload);

            if (!validators.isValid(message)) {
                drop(sender, MessageDroppedEvent.Reason.VALIDATION_FAILED, tag, message.toString());
                return;
            }

            Optional<N1mmMessageType> route = N1mmMessageType.forPayloadType(message.getClass());
            if (route.isEmpty()) {
                drop(sender, MessageDroppedEvent.Reason.UNHANDLED_TYPE, tag, message.getClass().getName());
                return;
            }

            route.get().dispatch(handler, message, sender, cancellation);
        } catch (MessageDecodeException e) {
            MessageDroppedEvent.Reason reason = e.tag() == null
                ? MessageDroppedEvent.Reason.MALFORMED_PAYLOAD
                : MessageDroppedEvent.Reason.DECODE_FAILED;
            drop(sender, reason, e.tag(), e.getMessage());
        } catch (RuntimeException e) {
            sink.onError(new GatewayErrorEvent(wallClock.now(),
                "Error processing N1MM message '" + tag + "' from " + sender, e));
        }
    }

    private N1mmMessage decode(String tag, Class<? extends N1mmMessage> type, OwnedBuffer payload)
    {
        try (InputStream in = payload.openStream()) {
            N1mmMessage message = mapper.readValue(in, type);
            if (message == null) {
                throw new MessageDecodeException(tag, "Payload decoded to nothing");
            }
            return message;
        } catch (IOException e) {
            throw new MessageDecodeException(tag, "Failed to decode '" + tag + "': " + e.getMessage(), e);
        }
    }

    private void drop(InetSocketAddress sender, MessageDroppedEvent.Reason reason, String tag, String detail)
    {
        sink.onMessageDropped(new MessageDroppedEvent(wallClock.now(), sender, reason, tag, detail));
    }

    public static final class Builder
    {
        private final N1mmMessageHandler handler;
        private TagRegistry tags = TagRegistry.defaults();
        private ValidatorRegistry validators = defaultValidators();
        private GatewayObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        private Builder(N1mmMessageHandler handler)
        {
            this.handler = handler;
        }

        public Builder withTagRegistry(TagRegistry tags)
        {
            this.tags = tags;
            return this;
        }

        public Builder withValidators(ValidatorRegistry validators)
        {
            this.validators = validators;
            return this;
        }

        public Builder withObservabilitySink(GatewayObservabilitySink sink)
        {
            this.sink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public N1mmMessageRouter build()
        {
            return new N1mmMessageRouter(this);
        }
    }
}
