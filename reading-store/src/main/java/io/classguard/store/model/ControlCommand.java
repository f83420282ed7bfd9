package io.classguard.store.model;

import java.time.Instant;
import java.util.Objects;

public class ControlCommand {
    private long id;
    private final Device device;
    private final boolean state;
    private final Instant issuedAt;
    private final String issuedBy;

    public ControlCommand(Device device, boolean state, Instant issuedAt, String issuedBy) {
        this.device = Objects.requireNonNull(device, "device");
        this.state = state;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.issuedBy = issuedBy;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public Device getDevice() { return device; }
    public boolean getState() { return state; }
    public Instant getIssuedAt() { return issuedAt; }
    public String getIssuedBy() { return issuedBy; }

    @Override
    public String toString() {
        return "ControlCommand{device=" + device.wireName() + ", state=" + state
                + ", issuedAt=" + issuedAt + ", issuedBy='" + issuedBy + "'}";
    }
}
