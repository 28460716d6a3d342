package io.cwrelay.core.sink;

import io.cwrelay.core.model.OutputRecord;

/**
 * Destination of output records. Held open for one run and closed on every exit path.
 */
public interface MetricSink extends AutoCloseable {

    /**
     * @throws io.cwrelay.core.SinkException when the record cannot be delivered
     */
    void send(OutputRecord record);

    @Override
    void close();
}
