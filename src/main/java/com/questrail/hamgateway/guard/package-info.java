/**
 * Per-source admission checks applied before a payload is accepted.
 */
package com.questrail.hamgateway.guard;
