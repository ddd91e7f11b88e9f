/**
 * Cancellation signals consumed by retry loops. {@link com.sailfish.retry.cancel.CancelContext}
 * supports explicit cancellation, deadlines and parent/child propagation.
 */
package com.sailfish.retry.cancel;
