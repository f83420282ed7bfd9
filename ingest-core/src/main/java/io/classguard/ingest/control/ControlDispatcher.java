package io.classguard.ingest.control;

import io.classguard.ingest.cache.LatestStateCache;
import io.classguard.store.model.ControlCommand;
import io.classguard.store.model.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;

/**
 * Validates operator control requests and hands accepted ones to the
 * {@link CommandPublisher}.
 * <p>
 * The role check runs before the device check, so an unprivileged caller
 * learns nothing about which device names exist. Accepted commands update the
 * cached device status straight away; the node's acknowledgement later
 * confirms or corrects it. Concurrent accepted commands reach the cache and
 * the publisher in the same order, so the cached state always matches the
 * last command handed to the publisher.
 */
public class ControlDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ControlDispatcher.class);
    private static final String ANONYMOUS = "anonymous";

    private final LatestStateCache cache;
    private final CommandPublisher publisher;
    private final Set<String> privilegedRoles;
    private final Clock clock;
    private final Object dispatchLock = new Object();

    public ControlDispatcher(LatestStateCache cache, CommandPublisher publisher,
                             Set<String> privilegedRoles, Clock clock) {
        this.cache = cache;
        this.publisher = publisher;
        this.privilegedRoles = privilegedRoles;
        this.clock = clock;
    }

    public ControlResult issue(String deviceName, boolean state, String actorRole) {
        return issue(deviceName, state, actorRole, null);
    }

    public ControlResult issue(String deviceName, boolean state, String actorRole, String issuedBy) {
        String operator = issuedBy == null || issuedBy.isBlank() ? ANONYMOUS : issuedBy;
        if (!isPrivileged(actorRole)) {
            logger.warn("Control request from {} with role '{}' rejected", operator, actorRole);
            return ControlResult.UNAUTHORIZED;
        }

        Optional<Device> device = Device.fromName(deviceName);
        if (device.isEmpty()) {
            logger.warn("Control request from {} for unknown device '{}'", operator, deviceName);
            return ControlResult.INVALID_DEVICE;
        }

        ControlCommand command;
        // cache order and publish order must agree for concurrent commands
        synchronized (dispatchLock) {
            command = new ControlCommand(device.get(), state, clock.instant(), operator);
            cache.setDeviceState(device.get(), state);
            try {
                publisher.submit(command);
            } catch (RejectedExecutionException e) {
                logger.error("Command {} accepted but the publisher is shut down", command);
            }
        }
        logger.info("{} set {} {}", operator, device.get().wireName(), state ? "ON" : "OFF");
        return ControlResult.SUCCESS;
    }

    private boolean isPrivileged(String role) {
        return role != null && privilegedRoles.contains(role.trim().toLowerCase(Locale.ROOT));
    }
}
