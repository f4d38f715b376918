/**
 * Single-worker FIFO queue that runs the reasoning loop for each submitted request and streams
 * {@link com.phillippitts.agentcore.domain.ProgressEvent ProgressEvent}s to subscribers.
 *
 * <p>Late subscribers receive the request's event history before live events.</p>
 */
package com.phillippitts.agentcore.service.queue;
