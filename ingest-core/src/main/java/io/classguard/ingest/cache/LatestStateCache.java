package io.classguard.ingest.cache;

import io.classguard.store.model.Device;
import io.classguard.store.model.DeviceStatus;
import io.classguard.store.model.Reading;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory holder of the most recent reading and the device on/off states.
 * <p>
 * Both live in one immutable {@link StateSnapshot} behind an atomic reference,
 * so a reader always sees a pair that existed at some instant. Writers never
 * block readers and no operation touches I/O.
 */
public class LatestStateCache {

    private final AtomicReference<StateSnapshot> current =
            new AtomicReference<>(new StateSnapshot(Reading.empty(), DeviceStatus.allOff()));

    public StateSnapshot get() {
        return current.get();
    }

    public void setReading(Reading reading) {
        current.updateAndGet(snapshot -> snapshot.withReading(reading));
    }

    public void setDeviceState(Device device, boolean on) {
        current.updateAndGet(snapshot -> snapshot.withDeviceStatus(snapshot.getDeviceStatus().with(device, on)));
    }

    /**
     * Applies device states confirmed by the classroom node, overriding any
     * optimistic value set at dispatch time.
     */
    public void applyDeviceStates(Map<Device, Boolean> states) {
        current.updateAndGet(snapshot -> snapshot.withDeviceStatus(snapshot.getDeviceStatus().withAll(states)));
    }
}
