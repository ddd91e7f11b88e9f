/**
 * The asynchronous retry registry, {@link com.sailfish.retry.service.AsyncRetryRegistry},
 * and its default implementation in the {@code impl} subpackage.
 */
package com.sailfish.retry.service;
