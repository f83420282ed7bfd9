package io.classguard.ingest.control;

import io.classguard.ingest.cache.LatestStateCache;
import io.classguard.store.model.ControlCommand;
import io.classguard.store.model.Device;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ControlDispatcherTest {

    private static final Instant NOW = Instant.parse("2025-03-10T08:30:00Z");

    @Mock
    private CommandPublisher publisher;

    private final LatestStateCache cache = new LatestStateCache();

    private ControlDispatcher dispatcher() {
        return new ControlDispatcher(cache, publisher, Set.of("admin"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("an admin switching the fan on succeeds, updates the cache and publishes")
    void adminTurnsFanOn() {
        ControlResult result = dispatcher().issue("fan", true, "admin", "teacher1");

        assertThat(result).isEqualTo(ControlResult.SUCCESS);
        assertThat(cache.get().getDeviceStatus().isOn(Device.FAN)).isTrue();
        ArgumentCaptor<ControlCommand> command = ArgumentCaptor.forClass(ControlCommand.class);
        verify(publisher).submit(command.capture());
        assertThat(command.getValue().getDevice()).isEqualTo(Device.FAN);
        assertThat(command.getValue().getState()).isTrue();
        assertThat(command.getValue().getIssuedAt()).isEqualTo(NOW);
        assertThat(command.getValue().getIssuedBy()).isEqualTo("teacher1");
    }

    @Test
    @DisplayName("non-privileged roles are rejected before anything happens")
    void viewerIsUnauthorized() {
        assertThat(dispatcher().issue("fan", true, "viewer")).isEqualTo(ControlResult.UNAUTHORIZED);
        assertThat(dispatcher().issue("fan", true, null)).isEqualTo(ControlResult.UNAUTHORIZED);

        assertThat(cache.get().getDeviceStatus().isOn(Device.FAN)).isFalse();
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("authorization is checked before the device name")
    void authorizationComesFirst() {
        assertThat(dispatcher().issue("heater", true, "viewer")).isEqualTo(ControlResult.UNAUTHORIZED);
    }

    @Test
    @DisplayName("unknown devices are rejected for privileged callers")
    void unknownDevice() {
        assertThat(dispatcher().issue("heater", true, "admin")).isEqualTo(ControlResult.INVALID_DEVICE);
        assertThat(dispatcher().issue(null, true, "admin")).isEqualTo(ControlResult.INVALID_DEVICE);

        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("device names and roles are case-insensitive")
    void caseInsensitive() {
        assertThat(dispatcher().issue("Light", false, "ADMIN")).isEqualTo(ControlResult.SUCCESS);
        assertThat(dispatcher().issue(" BUZZER ", true, " Admin ")).isEqualTo(ControlResult.SUCCESS);

        assertThat(cache.get().getDeviceStatus().isOn(Device.BUZZER)).isTrue();
    }

    @Test
    @DisplayName("a shut-down publisher does not turn an accepted request into a failure")
    void publisherRejectionIsLogged() {
        doThrow(new RejectedExecutionException("shut down")).when(publisher).submit(any());

        assertThat(dispatcher().issue("fan", true, "admin")).isEqualTo(ControlResult.SUCCESS);
    }

    @Test
    @DisplayName("concurrent opposite commands leave the cache matching the last published command")
    void concurrentCommandsStayInPublishOrder() throws Exception {
        List<ControlCommand> published = Collections.synchronizedList(new ArrayList<>());
        CommandPublisher recording = new CommandPublisher() {
            @Override
            public void submit(ControlCommand command) {
                Thread.yield();
                published.add(command);
            }

            @Override
            public void close() {
            }
        };
        ControlDispatcher shared = new ControlDispatcher(cache, recording, Set.of("admin"),
                Clock.fixed(NOW, ZoneOffset.UTC));
        ExecutorService operators = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        try {
            for (int t = 0; t < 8; t++) {
                boolean state = t % 2 == 0;
                operators.execute(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < 200; i++) {
                        shared.issue("fan", state, "admin");
                    }
                });
            }
            go.countDown();
        } finally {
            operators.shutdown();
        }
        assertThat(operators.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(published).hasSize(1_600);
        assertThat(cache.get().getDeviceStatus().isOn(Device.FAN))
                .isEqualTo(published.get(published.size() - 1).getState());
    }

    @Test
    void resultMessages() {
        assertThat(ControlResult.UNAUTHORIZED.getMessage()).isEqualTo("Unauthorized");
        assertThat(ControlResult.INVALID_DEVICE.getMessage()).isEqualTo("Invalid device");
        assertThat(ControlResult.SUCCESS.isSuccess()).isTrue();
    }
}
