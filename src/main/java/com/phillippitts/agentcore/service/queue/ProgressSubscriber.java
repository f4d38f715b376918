package com.phillippitts.agentcore.service.queue;

import com.phillippitts.agentcore.domain.ProgressEvent;

/**
 * Receives request progress events. Called on the thread making the transition; must not block.
 * Exceptions are logged and otherwise ignored.
 */
@FunctionalInterface
public interface ProgressSubscriber {

    void onEvent(ProgressEvent event);
}
