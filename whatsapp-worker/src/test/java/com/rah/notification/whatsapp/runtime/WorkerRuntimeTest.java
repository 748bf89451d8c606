package com.rah.notification.whatsapp.runtime;

import com.rah.notification.whatsapp.session.WhatsAppSessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkerRuntimeTest {

    @Mock
    private WhatsAppSessionManager sessionManager;

    @Mock
    private KafkaListenerEndpointRegistry listenerRegistry;

    @Mock
    private MessageListenerContainer reminderContainer;

    @Mock
    private MessageListenerContainer sendContainer;

    private WorkerRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new WorkerRuntime(sessionManager, listenerRegistry);
        lenient().when(listenerRegistry.getListenerContainers()).thenReturn(List.of(reminderContainer, sendContainer));
    }

    @Test
    void testStart_InitializesSessionBeforeContainers() {
        runtime.start();

        InOrder order = inOrder(sessionManager, reminderContainer, sendContainer);
        order.verify(sessionManager).initialize();
        order.verify(reminderContainer).start();
        order.verify(sendContainer).start();
        assertTrue(runtime.isRunning());
    }

    @Test
    void testStop_StopsContainersBeforeSession() {
        when(reminderContainer.isRunning()).thenReturn(true);
        when(sendContainer.isRunning()).thenReturn(true);

        runtime.stop();

        InOrder order = inOrder(reminderContainer, sendContainer, sessionManager);
        order.verify(reminderContainer).stop();
        order.verify(sendContainer).stop();
        order.verify(sessionManager).shutdown();
        assertFalse(runtime.isRunning());
    }

    @Test
    void testPhase_AfterListenerRegistry() {
        assertTrue(runtime.getPhase() > new KafkaListenerEndpointRegistry().getPhase());
    }
}
