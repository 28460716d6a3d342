package io.cwrelay.core.sink;

import io.cwrelay.core.model.OutputRecord;

import java.io.PrintStream;

/**
 * Prints lines prefixed with the proxy address instead of sending them.
 */
public class DryRunSink implements MetricSink {

    private final PrintStream out;
    private final String label;

    public DryRunSink(PrintStream out, String host, int port) {
        this.out = out;
        this.label = "[" + host + ":" + port + "] ";
    }

    @Override
    public void send(OutputRecord record) {
        out.println(label + WavefrontLineFormat.format(record));
    }

    @Override
    public void close() {
        out.flush();
    }
}
