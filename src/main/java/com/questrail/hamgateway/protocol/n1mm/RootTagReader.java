package com.questrail.hamgateway.protocol.n1mm;

import com.questrail.hamgateway.message.MessageDecodeException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads the root element name of an XML payload without parsing the rest of it.
 */
final class RootTagReader
{
    private final XMLInputFactory factory;

    RootTagReader(XMLInputFactory factory)
    {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * @return the root element's local name, lower-cased
     * @throws MessageDecodeException (with no tag) if the payload does not
     *                                start with a well-formed root element
     */
    String readRootTag(InputStream payload)
    {
        try {
            XMLStreamReader reader = factory.createXMLStreamReader(payload);
            try {
                reader.nextTag();
                return reader.getLocalName().toLowerCase(Locale.ROOT);
            } finally {
                reader.close();
            }
        } catch (XMLStreamException e) {
            throw new MessageDecodeException(null, "Malformed payload: " + e.getMessage(), e);
        }
    }
}
