package com.rah.notification.whatsapp.session;

import com.rah.notification.whatsapp.enums.DisconnectReason;
import com.rah.notification.whatsapp.enums.SessionState;
import com.rah.notification.whatsapp.model.SessionCredentials;
import com.rah.notification.whatsapp.model.SessionStatus;
import com.rah.notification.whatsapp.transport.ConnectionUpdate;
import com.rah.notification.whatsapp.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WhatsAppSessionManagerTest {

    private static final Instant NOW = Instant.parse("2026-02-09T12:00:00Z");
    private static final Duration RECONNECT_DELAY = Duration.ofSeconds(3);
    private static final SessionCredentials STORED = new SessionCredentials("41276", "key-1", "5527999999999", NOW);

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private TaskScheduler taskScheduler;

    private final List<Runnable> scheduled = new ArrayList<>();
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();

    private FakeTransport transport;
    private WhatsAppSessionManager manager;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        when(credentialStore.load()).thenReturn(Optional.of(STORED));
        doAnswer(invocation -> {
            scheduled.add(invocation.getArgument(0));
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            futures.add(future);
            return future;
        }).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        manager = new WhatsAppSessionManager(transport, credentialStore, taskScheduler, RECONNECT_DELAY,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testInitialize_OpensConnectionWithStoredCredentials() {
        manager.initialize();

        assertEquals(SessionState.CONNECTING, manager.getState());
        assertFalse(manager.isReady());
        assertEquals(List.of(STORED), transport.openedWith);
    }

    @Test
    void testInitialize_IsIdempotent() {
        manager.initialize();
        manager.initialize();

        assertEquals(1, transport.connections.size());
        verify(credentialStore, times(1)).load();
    }

    @Test
    void testOpen_MakesSessionReady() {
        manager.initialize();
        transport.last().emit(ConnectionUpdate.open());

        assertTrue(manager.isReady());
        assertEquals(SessionState.READY, manager.getState());
    }

    @Test
    void testSend_NotReady_ReturnsNotConnectedWithoutNetwork() {
        manager.initialize();

        SendResult result = manager.send("5527999999999", "Olá");

        assertEquals(new SendResult.Failure(SendResult.NOT_CONNECTED), result);
        assertTrue(transport.last().sent.isEmpty());
    }

    @Test
    void testSend_BeforeInitialize_ReturnsNotConnected() {
        SendResult result = manager.send("5527999999999", "Olá");

        assertEquals(SendResult.notConnected(), result);
        assertTrue(transport.connections.isEmpty());
    }

    @Test
    void testSend_Ready_SendsToPhoneJid() {
        manager.initialize();
        transport.last().emit(ConnectionUpdate.open());

        SendResult result = manager.send("+55 (27) 99999-9999", "Olá");

        assertEquals(new SendResult.Success("MSG-1"), result);
        assertEquals(List.of("5527999999999@s.whatsapp.net|Olá"), transport.last().sent);
    }

    @Test
    void testSend_MissingMessageId_ReportsUnknown() {
        manager.initialize();
        transport.last().emit(ConnectionUpdate.open());
        transport.last().nextMessageId = null;

        assertEquals(new SendResult.Success("unknown"), manager.send("5527999999999", "Olá"));
    }

    @Test
    void testSend_TransportError_ReturnsFailureAndDoesNotThrow() {
        manager.initialize();
        transport.last().emit(ConnectionUpdate.open());
        transport.last().sendFailure = new TransportException("WASender API error 500", 500, null);

        SendResult result = manager.send("5527999999999", "Olá");

        assertEquals(new SendResult.Failure("WASender API error 500"), result);
        assertTrue(manager.isReady());
    }

    @Test
    void testClose_NonTerminal_SchedulesSingleReconnect() {
        manager.initialize();
        FakeTransport.FakeConnection first = transport.last();
        first.emit(ConnectionUpdate.open());

        first.emit(ConnectionUpdate.close(DisconnectReason.CONNECTION_LOST));

        assertEquals(SessionState.DISCONNECTED, manager.getState());
        assertFalse(manager.isReady());
        assertTrue(first.closed);
        assertEquals(1, scheduled.size());
        verify(taskScheduler).schedule(any(Runnable.class), eq(NOW.plus(RECONNECT_DELAY)));

        scheduled.get(0).run();

        assertEquals(SessionState.CONNECTING, manager.getState());
        assertEquals(2, transport.connections.size());
    }

    @Test
    void testClose_FromSupersededConnection_IsIgnored() {
        manager.initialize();
        FakeTransport.FakeConnection first = transport.last();
        first.emit(ConnectionUpdate.close(DisconnectReason.CONNECTION_CLOSED));
        scheduled.get(0).run();
        FakeTransport.FakeConnection second = transport.last();
        second.emit(ConnectionUpdate.open());

        first.emit(ConnectionUpdate.close(DisconnectReason.CONNECTION_LOST));
        first.emit(ConnectionUpdate.close(DisconnectReason.LOGGED_OUT));

        assertTrue(manager.isReady());
        assertEquals(1, scheduled.size());
        assertFalse(second.closed);
    }

    @Test
    void testReconnect_OnlyOnePendingAtATime() {
        manager.initialize();
        FakeTransport.FakeConnection first = transport.last();

        first.emit(ConnectionUpdate.close(DisconnectReason.CONNECTION_LOST));
        first.emit(ConnectionUpdate.close(DisconnectReason.CONNECTION_CLOSED));

        assertEquals(1, scheduled.size());
    }

    @Test
    void testOpenFailure_SchedulesReconnect() {
        manager.initialize();
        transport.failNextOpen = new TransportException("network down", null, null);
        transport.last().emit(ConnectionUpdate.close(DisconnectReason.CONNECTION_LOST));

        scheduled.get(0).run();

        assertEquals(SessionState.DISCONNECTED, manager.getState());
        assertEquals(DisconnectReason.UNKNOWN, manager.getStatus().lastDisconnectReason());
        assertEquals(2, scheduled.size());
    }

    @Test
    void testOpenFailure_WithUnauthorizedStatus_LogsOut() {
        transport.failNextOpen = new TransportException("unauthorized", 401, null);

        manager.initialize();

        assertEquals(SessionState.LOGGED_OUT, manager.getState());
        assertEquals(DisconnectReason.LOGGED_OUT, manager.getStatus().lastDisconnectReason());
        assertTrue(scheduled.isEmpty());
    }

    @Test
    void testLoggedOut_IsTerminalUntilRelink() {
        manager.initialize();
        transport.last().emit(ConnectionUpdate.open());

        transport.last().emit(ConnectionUpdate.close(DisconnectReason.LOGGED_OUT));

        assertEquals(SessionState.LOGGED_OUT, manager.getState());
        assertTrue(scheduled.isEmpty());
        assertEquals(SendResult.notConnected(), manager.send("5527999999999", "Olá"));
        assertEquals(1, transport.connections.size());
    }

    @Test
    void testRelink_ClearsCredentialsAndPairsNewDevice() {
        manager.initialize();
        transport.last().emit(ConnectionUpdate.close(DisconnectReason.LOGGED_OUT));

        SessionStatus status = manager.relink();

        verify(credentialStore).clear();
        assertEquals(SessionState.CONNECTING, status.state());
        assertFalse(status.credentialsStored());
        assertNull(transport.openedWith.get(1));

        transport.last().emit(ConnectionUpdate.pairing("2@qr-code"));
        assertEquals("2@qr-code", manager.getStatus().pairingCode());

        transport.last().emit(ConnectionUpdate.open());
        assertTrue(manager.isReady());
        assertNull(manager.getStatus().pairingCode());
    }

    @Test
    void testRelink_CancelsPendingReconnect() {
        manager.initialize();
        transport.last().emit(ConnectionUpdate.close(DisconnectReason.CONNECTION_LOST));

        manager.relink();

        verify(futures.get(0)).cancel(false);
    }

    @Test
    void testCredentialsUpdate_PersistedBeforeListenerReturns() {
        manager.initialize();
        SessionCredentials updated = new SessionCredentials("41276", "key-2", "5527999999999", NOW);

        transport.last().listener.onCredentialsUpdate(updated);

        verify(credentialStore).save(updated);
        assertTrue(manager.getStatus().credentialsStored());
    }

    @Test
    void testShutdown_ClosesConnectionAndStopsReconnecting() {
        manager.initialize();
        FakeTransport.FakeConnection first = transport.last();
        first.emit(ConnectionUpdate.open());

        manager.shutdown();
        first.emit(ConnectionUpdate.close(DisconnectReason.CONNECTION_LOST));

        assertTrue(first.closed);
        assertEquals(SessionState.DISCONNECTED, manager.getState());
        assertTrue(scheduled.isEmpty());
        assertEquals(SendResult.notConnected(), manager.send("5527999999999", "Olá"));
    }

    @Test
    void testShutdown_ThenRelink_IsRejected() {
        manager.initialize();
        manager.shutdown();

        assertThrows(IllegalStateException.class, () -> manager.relink());
    }

    @Test
    void testToJid_KeepsFullJid() {
        assertEquals("123@g.us", WhatsAppSessionManager.toJid("123@g.us"));
        assertEquals("5527999999999@s.whatsapp.net", WhatsAppSessionManager.toJid("5527999999999"));
    }
}
