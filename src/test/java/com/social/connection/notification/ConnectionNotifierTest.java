package com.social.connection.notification;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.SharedAssignment;
import com.social.connection.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConnectionNotifier Tests")
class ConnectionNotifierTest {

    @Mock
    private NotificationSender sender;

    @Mock
    private MetricsService metrics;

    private InMemoryIdentityDirectory directory;
    private ConnectionNotifier notifier;
    private Connection<SharedAssignment> connection;

    @BeforeEach
    void setUp() {
        directory = new InMemoryIdentityDirectory()
                .register(new UserProfile("alice", "Alice", "token-a"))
                .register(new UserProfile("bob", "Bob", "token-b"));
        notifier = new ConnectionNotifier(directory, sender, metrics);
        connection = Connection.<SharedAssignment>builder()
                .id("c-1")
                .initiatorId("alice")
                .recipientId("bob")
                .assignment(new SharedAssignment(BucketType.INNER, "Friend", "friend"))
                .build();
    }

    @Test
    @DisplayName("Request goes to the recipient, titled with the initiator's name")
    void requestSent() {
        notifier.requestSent(connection);

        ArgumentCaptor<NotificationPayload> payload = ArgumentCaptor.forClass(NotificationPayload.class);
        verify(sender).send(eq(NotificationKind.CONNECTION_REQUEST), eq("bob"), payload.capture());
        assertEquals("New connection request from Alice", payload.getValue().title());
        assertEquals("token-b", payload.getValue().token());
        assertEquals("high", payload.getValue().priority());
        assertEquals("/connection/c-1", payload.getValue().clickAction());
        assertEquals(Map.of("connection_id", "c-1", "type", "connection_request"), payload.getValue().data());
    }

    @Test
    @DisplayName("Accept and reject go to the initiator")
    void acceptedAndRejected() {
        notifier.accepted(connection);
        notifier.rejected(connection);

        ArgumentCaptor<NotificationPayload> payload = ArgumentCaptor.forClass(NotificationPayload.class);
        verify(sender).send(eq(NotificationKind.CONNECTION_ACCEPTED), eq("alice"), payload.capture());
        assertEquals("Bob accepted your connection request", payload.getValue().title());
        verify(sender).send(eq(NotificationKind.CONNECTION_REJECTED), eq("alice"), any());
    }

    @Test
    @DisplayName("Target without a device token is skipped")
    void noToken() {
        directory.register(new UserProfile("bob", "Bob", null));

        notifier.requestSent(connection);

        verifyNoInteractions(sender);
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("Unknown actor falls back to the user id in the title")
    void unknownActor() {
        Connection<SharedAssignment> fromStranger = Connection.<SharedAssignment>builder()
                .id("c-2").initiatorId("zed").recipientId("bob")
                .assignment(new SharedAssignment(null, "Friend", "friend"))
                .build();

        notifier.requestSent(fromStranger);

        ArgumentCaptor<NotificationPayload> payload = ArgumentCaptor.forClass(NotificationPayload.class);
        verify(sender).send(any(), eq("bob"), payload.capture());
        assertEquals("New connection request from zed", payload.getValue().title());
    }

    @Test
    @DisplayName("Sender failure is counted and never thrown")
    void failureSwallowed() {
        doThrow(new IllegalStateException("down")).when(sender).send(any(), anyString(), any());

        assertDoesNotThrow(() -> notifier.requestSent(connection));

        verify(metrics).incrementNotificationFailed();
    }
}
