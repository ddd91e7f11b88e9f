/**
 * Value types describing the state and outcome of retry loops.
 */
package com.sailfish.retry.model;
