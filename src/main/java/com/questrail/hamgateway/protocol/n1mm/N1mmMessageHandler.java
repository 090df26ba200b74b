package com.questrail.hamgateway.protocol.n1mm;

import com.questrail.hamgateway.protocol.n1mm.schema.AppInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactDelete;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.ContactReplace;
import com.questrail.hamgateway.protocol.n1mm.schema.DynamicResults;
import com.questrail.hamgateway.protocol.n1mm.schema.LookupInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.RadioInfo;
import com.questrail.hamgateway.protocol.n1mm.schema.Spot;
import com.questrail.hamgateway.server.CancellationSignal;

import java.net.InetSocketAddress;

/**
 * N1mmMessageHandler
 * =============================================================================
 * Application callback receiving decoded and validated N1MM messages.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Each message reaches exactly one operation, chosen by its exact type.
 *       A {@link ContactReplace} never reaches {@link #handleContactInfo}.</li>
 *   <li>Operations run on a processing thread, never on an I/O thread, and
 *       may be invoked concurrently.</li>
 *   <li>Operations MUST NOT block indefinitely. Long work should observe the
 *       cancellation signal.</li>
 *   <li>An exception thrown by an operation is reported as a processing
 *       fault; it does not affect the listener.</li>
 * </ul>
 */
public interface N1mmMessageHandler
{
    void handleAppInfo(AppInfo message, InetSocketAddress sender, CancellationSignal cancellation);

    void handleContactInfo(ContactInfo message, InetSocketAddress sender, CancellationSignal cancellation);

    void handleContactReplace(ContactReplace message, InetSocketAddress sender, CancellationSignal cancellation);

    void handleContactDelete(ContactDelete message, InetSocketAddress sender, CancellationSignal cancellation);

    void handleLookupInfo(LookupInfo message, InetSocketAddress sender, CancellationSignal cancellation);

    void handleSpot(Spot message, InetSocketAddress sender, CancellationSignal cancellation);

    void handleDynamicResults(DynamicResults message, InetSocketAddress sender, CancellationSignal cancellation);

    void handleRadioInfo(RadioInfo message, InetSocketAddress sender, CancellationSignal cancellation);
}
