package io.classguard.ingest.control;

import io.classguard.store.model.ControlCommand;

import java.util.concurrent.RejectedExecutionException;

/**
 * Delivers accepted commands to the classroom node. Implementations must not
 * block the caller on the broker.
 */
public interface CommandPublisher extends AutoCloseable {

    /**
     * @throws RejectedExecutionException if the publisher has been closed
     */
    void submit(ControlCommand command);

    @Override
    void close();
}
