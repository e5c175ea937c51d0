package de.bsommerfeld.launchpad.lifecycle.audit;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.launchpad.core.event.ApplicationEventBus;
import de.bsommerfeld.launchpad.core.event.InstanceEvent;
import de.bsommerfeld.launchpad.core.event.InstanceEventType;
import de.bsommerfeld.launchpad.core.spi.AuditAction;

/**
 * Writes an audit entry for every instance that ends, whether it was closed
 * on request, exited on its own or failed. Requested actions are audited by
 * the orchestrator itself; this covers what happens without a request.
 */
@Singleton
public class LifecycleAuditSubscriber {

    private final AuditRecorder recorder;

    @Inject
    public LifecycleAuditSubscriber(ApplicationEventBus eventBus, AuditRecorder recorder) {
        this.recorder = recorder;
        eventBus.register(this);
    }

    @Subscribe
    public void onInstanceEvent(InstanceEvent event) {
        if (event.type() != InstanceEventType.STOPPED && event.type() != InstanceEventType.ERROR) {
            return;
        }
        String details = event.previousState() + " -> " + event.newState()
                + event.reasonText().map(r -> " (" + r + ")").orElse("");
        recorder.record(event.instance(), AuditAction.STATE_CHANGE, event.type() == InstanceEventType.STOPPED,
                details);
    }
}
