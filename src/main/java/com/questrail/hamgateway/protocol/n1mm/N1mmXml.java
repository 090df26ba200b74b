package com.questrail.hamgateway.protocol.n1mm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import javax.xml.stream.XMLInputFactory;

/**
 * Jackson XML configuration for N1MM payloads.
 */
public final class N1mmXml
{
    private N1mmXml() {}

    /**
     * Creates a mapper that ignores unknown elements and never resolves DTDs
     * or external entities. Payloads arrive from the network unauthenticated.
     */
    public static XmlMapper newMapper()
    {
        XMLInputFactory input = XMLInputFactory.newFactory();
        input.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        input.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);

        XmlMapper mapper = new XmlMapper(new XmlFactory(input));
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
