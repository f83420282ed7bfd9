package io.classguard.ingest.subscriber;

public enum SubscriberState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED,
    STOPPED
}
