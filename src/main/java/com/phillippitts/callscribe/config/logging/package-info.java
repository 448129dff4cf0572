/**
 * Logging configuration and request-scoped ThreadContext support.
 */
package com.phillippitts.callscribe.config.logging;
