package io.gridsweep.observability;

import java.io.PrintStream;

public final class ConsoleEventSink implements EventSink {
    private final PrintStream out;
    private final boolean verbose;

    public ConsoleEventSink(PrintStream out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    @Override
    public synchronized void emit(SweepEvent event) {
        if (event.level() == SweepEvent.Level.INFO && !verbose) {
            return;
        }
        StringBuilder line = new StringBuilder()
                .append('[').append(event.level()).append("] ")
                .append(event.action());
        if (event.hash() != null) {
            line.append(" hash=").append(shortHash(event.hash()));
        }
        if (event.message() != null && !event.message().isBlank()) {
            line.append(" - ").append(event.message());
        }
        out.println(line);
    }

    private static String shortHash(String hash) {
        return hash.length() <= 12 ? hash : hash.substring(0, 12);
    }
}
