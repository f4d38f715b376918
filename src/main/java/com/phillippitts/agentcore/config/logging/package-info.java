/**
 * Log4j2 {@code ThreadContext} plumbing for HTTP requests.
 */
package com.phillippitts.agentcore.config.logging;
