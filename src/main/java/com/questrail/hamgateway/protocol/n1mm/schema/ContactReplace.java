package com.questrail.hamgateway.protocol.n1mm.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * {@code <contactreplace>}: a logged QSO was edited. Carries the full
 * replacement contact.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "contactreplace")
public class ContactReplace extends ContactInfo {
}
