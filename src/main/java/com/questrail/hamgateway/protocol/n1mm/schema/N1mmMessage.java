package com.questrail.hamgateway.protocol.n1mm.schema;

/**
 * Marker for every decoded N1MM Logger+ broadcast.
 *
 * <p>Each implementation maps one root tag. The field definitions follow the
 * N1MM Logger+ external UDP broadcast documentation; elements this model does
 * not know are ignored during decoding.</p>
 */
public interface N1mmMessage {
}
