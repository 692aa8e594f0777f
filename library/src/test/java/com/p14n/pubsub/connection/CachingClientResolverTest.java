package com.p14n.pubsub.connection;

import com.p14n.pubsub.broker.BrokerClient;
import com.p14n.pubsub.error.ConnectionException;
import com.p14n.pubsub.error.ProfileNotFoundException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingClientResolverTest {

    @Mock
    private ConnectionProvider connections;

    @Mock
    private BrokerClient client;

    private final ConnectionProfile profile = new ConnectionProfile("local", "localhost", 6379);
    private CachingClientResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new CachingClientResolver(connections);
    }

    @Test
    void shouldOpenOneClientPerServer() throws Exception {
        when(connections.getProfile("local")).thenReturn(Optional.of(profile));
        when(connections.openClient(profile)).thenReturn(client);

        assertSame(client, resolver.resolve("local"));
        assertSame(client, resolver.resolve("local"));

        verify(connections, times(1)).openClient(profile);
    }

    @Test
    void shouldFailForMissingProfile() {
        when(connections.getProfile("nowhere")).thenReturn(Optional.empty());

        var e = assertThrows(ProfileNotFoundException.class, () -> resolver.resolve("nowhere"));
        assertEquals("nowhere", e.server());
    }

    @Test
    void shouldNotCacheFailedConnections() throws Exception {
        when(connections.getProfile("local")).thenReturn(Optional.of(profile));
        when(connections.openClient(profile))
                .thenThrow(new ConnectionException("connection refused"))
                .thenReturn(client);

        assertThrows(ConnectionException.class, () -> resolver.resolve("local"));
        assertSame(client, resolver.resolve("local"));
    }

    @Test
    void shouldReconnectAfterEvict() throws Exception {
        var replacement = mock(BrokerClient.class);
        when(connections.getProfile("local")).thenReturn(Optional.of(profile));
        when(connections.openClient(profile)).thenReturn(client, replacement);
        resolver.resolve("local");

        resolver.evict("local");

        verify(client).close();
        assertSame(replacement, resolver.resolve("local"));
    }

    @Test
    void shouldCloseEveryClientEvenWhenOneFails() throws Exception {
        var other = mock(BrokerClient.class);
        var otherProfile = new ConnectionProfile("other", "localhost", 6380);
        when(connections.getProfile("local")).thenReturn(Optional.of(profile));
        when(connections.getProfile("other")).thenReturn(Optional.of(otherProfile));
        when(connections.openClient(profile)).thenReturn(client);
        when(connections.openClient(otherProfile)).thenReturn(other);
        doThrow(new IllegalStateException("already gone")).when(client).close();
        resolver.resolve("local");
        resolver.resolve("other");

        resolver.close();

        verify(client).close();
        verify(other).close();
    }
}
