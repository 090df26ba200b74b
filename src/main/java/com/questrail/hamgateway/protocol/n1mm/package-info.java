/**
 * N1MM Logger+ Message Routing
 * =============================================================================
 *
 * <p>This package turns a raw payload received by a listener into a call on
 * an {@link com.questrail.hamgateway.protocol.n1mm.N1mmMessageHandler}.</p>
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   OwnedBuffer payload
 *        → RootTagReader          (root element name, lower-cased)
 *            → TagRegistry        (tag → payload class)
 *                → XmlMapper      (payload class instance)
 *                    → ValidatorRegistry
 *                        → N1mmMessageType.dispatch
 *                            → N1mmMessageHandler
 * </pre>
 *
 * <h2>Failure handling</h2>
 * <p>Every stage that rejects a payload reports a
 * {@link com.questrail.hamgateway.observability.MessageDroppedEvent} and
 * returns. Nothing thrown by decoding or by a handler operation reaches the
 * listener; handler faults are reported as
 * {@link com.questrail.hamgateway.observability.GatewayErrorEvent}s.</p>
 *
 * <h2>Wire format</h2>
 * <ul>
 *   <li>Element names are matched as N1MM sends them; root tags are matched
 *       case-insensitively.</li>
 *   <li>Timestamps are zone-less local times, space- or {@code T}-separated.</li>
 *   <li>Decimal values may use a comma as the decimal separator.</li>
 *   <li>DTDs and external entities are never resolved.</li>
 * </ul>
 */
package com.questrail.hamgateway.protocol.n1mm;
