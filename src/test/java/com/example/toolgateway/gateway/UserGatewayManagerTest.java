package com.example.toolgateway.gateway;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.backend.BackendClientRegistry;
import com.example.toolgateway.backend.ToolDefinition;
import com.example.toolgateway.config.GatewayProperties;
import com.example.toolgateway.domain.Connection;
import com.example.toolgateway.exception.VaultException;
import com.example.toolgateway.service.AuditService;
import com.example.toolgateway.service.ConnectionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserGatewayManagerTest {

    @Mock
    private ConnectionService connectionService;

    @Mock
    private BackendClientRegistry clientRegistry;

    @Mock
    private ToolPolicyEngine policyEngine;

    @Mock
    private AuditService auditService;

    private ExecutorService buildExecutor;
    private UserGatewayManager manager;

    @BeforeEach
    void setUp() {
        buildExecutor = Executors.newFixedThreadPool(4);
        manager = new UserGatewayManager(connectionService, clientRegistry, policyEngine, auditService,
                new SimpleAsyncTaskExecutor(), buildExecutor, new SimpleMeterRegistry(), new GatewayProperties());
    }

    @AfterEach
    void tearDown() {
        buildExecutor.shutdownNow();
    }

    @Test
    void concurrentFirstAccessOpensEachConnectionOnce() throws Exception {
        Connection db = connection("c1", "sql", "Orders DB");
        Connection docs = connection("c2", "docs", "Wiki");
        BackendClient dbClient = connectedClient("list_tables");
        BackendClient docsClient = connectedClient("search_pages");
        CountDownLatch buildStarted = new CountDownLatch(1);
        CountDownLatch releaseBuild = new CountDownLatch(1);
        when(connectionService.getUserConnections("u1", true)).thenAnswer(invocation -> {
            buildStarted.countDown();
            assertTrue(releaseBuild.await(5, TimeUnit.SECONDS));
            return List.of(db, docs);
        });
        stubCredentials(db, docs);
        when(clientRegistry.create(eqConnection(db), any(), any())).thenReturn(dbClient);
        when(clientRegistry.create(eqConnection(docs), any(), any())).thenReturn(docsClient);

        ExecutorService callers = Executors.newSingleThreadExecutor();
        try {
            Future<ToolGateway> first = callers.submit(() -> manager.getOrBuild("u1"));
            assertTrue(buildStarted.await(5, TimeUnit.SECONDS));

            AtomicReference<ToolGateway> secondResult = new AtomicReference<>();
            Thread second = new Thread(() -> secondResult.set(manager.getOrBuild("u1")));
            second.start();
            awaitWaiting(second);
            assertFalse(first.isDone());

            releaseBuild.countDown();
            ToolGateway gateway = first.get(5, TimeUnit.SECONDS);
            second.join(5_000);

            assertSame(gateway, secondResult.get());
            assertEquals(2, gateway.getConnections().size());
        } finally {
            releaseBuild.countDown();
            callers.shutdownNow();
        }
        verify(dbClient, times(1)).connect();
        verify(docsClient, times(1)).connect();
        verify(connectionService, times(1)).getUserConnections("u1", true);
    }

    @Test
    void failingConnectionsAreSkipped() {
        Connection undecryptable = connection("c1", "sql", "Broken credentials");
        Connection unreachable = connection("c2", "sql", "Unreachable");
        Connection healthy = connection("c3", "docs", "Wiki");
        BackendClient unreachableClient = mock(BackendClient.class);
        when(unreachableClient.connect()).thenReturn(false);
        BackendClient healthyClient = connectedClient("read_page");

        when(connectionService.getUserConnections("u1", true)).thenReturn(List.of(undecryptable, unreachable, healthy));
        when(connectionService.getDecryptedCredentials(undecryptable)).thenThrow(new VaultException("Credential decryption failed"));
        stubCredentials(unreachable, healthy);
        when(clientRegistry.create(eqConnection(unreachable), any(), any())).thenReturn(unreachableClient);
        when(clientRegistry.create(eqConnection(healthy), any(), any())).thenReturn(healthyClient);

        ToolGateway gateway = manager.getOrBuild("u1");

        assertEquals(1, gateway.getConnections().size());
        assertEquals("c3", gateway.getConnections().iterator().next().id());
        assertEquals("docs.read_page", gateway.listTools().get(0).get("name"));
        verify(unreachableClient).disconnect();
    }

    @Test
    void returnsCachedGatewayOnSecondAccess() {
        when(connectionService.getUserConnections("u1", true)).thenReturn(List.of());

        ToolGateway first = manager.getOrBuild("u1");

        assertSame(first, manager.getOrBuild("u1"));
        assertTrue(manager.isCached("u1"));
        verify(connectionService, times(1)).getUserConnections("u1", true);
    }

    @Test
    void usersAreIsolated() {
        when(connectionService.getUserConnections(any(), eq(true))).thenReturn(List.of());

        assertNotSame(manager.getOrBuild("u1"), manager.getOrBuild("u2"));
        assertEquals("u2", manager.getOrBuild("u2").getUserId());
    }

    @Test
    void invalidateDisconnectsAndForcesRebuild() {
        Connection db = connection("c1", "sql", "Orders DB");
        BackendClient firstClient = connectedClient("query");
        BackendClient secondClient = connectedClient("query");
        when(connectionService.getUserConnections("u1", true)).thenReturn(List.of(db));
        stubCredentials(db);
        when(clientRegistry.create(eqConnection(db), any(), any())).thenReturn(firstClient, secondClient);

        ToolGateway first = manager.getOrBuild("u1");
        manager.invalidate("u1");

        assertFalse(manager.isCached("u1"));
        verify(firstClient, timeout(2000)).disconnect();

        ToolGateway rebuilt = manager.getOrBuild("u1");
        assertNotSame(first, rebuilt);
        verify(secondClient).connect();
    }

    @Test
    void reloadReturnsFreshGateway() {
        when(connectionService.getUserConnections("u1", true)).thenReturn(List.of());

        ToolGateway first = manager.getOrBuild("u1");
        ToolGateway reloaded = manager.reload("u1");

        assertNotSame(first, reloaded);
        assertSame(reloaded, manager.getOrBuild("u1"));
    }

    @Test
    void failedBuildPropagatesCause() {
        when(connectionService.getUserConnections("u1", true))
                .thenThrow(new IllegalStateException("registry unavailable"))
                .thenReturn(List.of());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> manager.getOrBuild("u1"));
        assertEquals("registry unavailable", e.getMessage());

        assertNotNull(manager.reload("u1"));
    }

    private static Connection connection(String id, String kind, String name) {
        return Connection.builder().id(id).ownerId("u1").kind(kind).name(name).enabled(true).build();
    }

    private static BackendClient connectedClient(String toolName) {
        BackendClient client = mock(BackendClient.class);
        when(client.connect()).thenReturn(true);
        when(client.listTools()).thenReturn(List.of(
                ToolDefinition.builder().name(toolName).description(toolName).parameters(Map.of()).build()));
        return client;
    }

    private void stubCredentials(Connection... connections) {
        for (Connection connection : connections) {
            when(connectionService.getDecryptedCredentials(connection)).thenReturn(Map.of());
            when(connectionService.getConfig(connection)).thenReturn(Map.of());
        }
    }

    private static Connection eqConnection(Connection connection) {
        return argThat(c -> c != null && connection.getId().equals(c.getId()));
    }

    /** Waits until the thread is parked on the shared build. */
    private static void awaitWaiting(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(Thread.State.WAITING, thread.getState());
    }
}
