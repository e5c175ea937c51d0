package de.bsommerfeld.launchpad.lifecycle.audit;

import de.bsommerfeld.launchpad.core.domain.ApplicationDescriptor;
import de.bsommerfeld.launchpad.core.domain.ApplicationKind;
import de.bsommerfeld.launchpad.core.domain.InstanceSnapshot;
import de.bsommerfeld.launchpad.core.domain.InstanceState;
import de.bsommerfeld.launchpad.core.event.ApplicationEventBus;
import de.bsommerfeld.launchpad.core.event.InstanceEvent;
import de.bsommerfeld.launchpad.core.event.InstanceEventType;
import de.bsommerfeld.launchpad.core.spi.AuditAction;
import de.bsommerfeld.launchpad.core.spi.AuditEntry;
import de.bsommerfeld.launchpad.core.spi.AuditSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LifecycleAuditSubscriberTest {

    private static final ApplicationDescriptor EDITOR = new ApplicationDescriptor("editor", "Editor",
            ApplicationKind.NATIVE_PROCESS, "editor.exe", "");

    @Mock
    private AuditSink sink;

    private ApplicationEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new ApplicationEventBus();
        new LifecycleAuditSubscriber(eventBus, new AuditRecorder(sink));
    }

    @Test
    void onInstanceEvent_shouldAuditStoppedInstances() {
        eventBus.post(event(InstanceEventType.STOPPED, InstanceState.RUNNING, InstanceState.TERMINATED));

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(sink).record(captor.capture());
        AuditEntry entry = captor.getValue();
        assertEquals(AuditAction.STATE_CHANGE, entry.action());
        assertEquals("editor", entry.descriptorId());
        assertTrue(entry.success());
        assertTrue(entry.details().contains("RUNNING -> TERMINATED"));
    }

    @Test
    void onInstanceEvent_shouldAuditErrorsAsFailures() {
        eventBus.post(event(InstanceEventType.ERROR, InstanceState.STARTING, InstanceState.ERROR));

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(sink).record(captor.capture());
        assertFalse(captor.getValue().success());
    }

    @Test
    void onInstanceEvent_shouldIgnoreOrdinaryTransitions() {
        eventBus.post(event(InstanceEventType.STATE_CHANGED, InstanceState.STARTING, InstanceState.RUNNING));
        eventBus.post(event(InstanceEventType.ACTIVATED, InstanceState.RUNNING, InstanceState.ACTIVE));

        verify(sink, never()).record(any());
    }

    @Test
    void record_shouldSwallowSinkFailure() {
        doThrow(new IllegalStateException("sink down")).when(sink).record(any());
        AuditRecorder recorder = new AuditRecorder(sink);

        assertDoesNotThrow(() -> recorder.record("alice", AuditAction.LAUNCH, EDITOR, true, ""));
    }

    private static InstanceEvent event(InstanceEventType type, InstanceState previous, InstanceState next) {
        Instant now = Instant.now();
        InstanceSnapshot snapshot = new InstanceSnapshot("native-1", EDITOR, "alice", 42, null, next, now, now,
                null, Map.of(), null);
        return new InstanceEvent(type, snapshot, now, previous, next, "test", "test");
    }
}
