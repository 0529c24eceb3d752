package io.fakegateway.core.worker;

import java.io.PrintStream;

/**
 * Destination for a function's output: prefixed stdout/stderr lines and the Lambda-style
 * {@code START}/{@code END}/{@code REPORT} lifecycle lines. Text arrives with its trailing newline.
 *
 * <p>
 * Implementations must tolerate calls from several pump threads.
 */
@FunctionalInterface
public interface LogSink {

    void write(String text);

    /** Writes to a print stream, flushing after each write. */
    static LogSink of(PrintStream stream) {
        return text -> {
            synchronized (stream) {
                stream.print(text);
                stream.flush();
            }
        };
    }

    /** The process's standard output. */
    static LogSink stdout() {
        return of(System.out);
    }

    /** The process's standard error. */
    static LogSink stderr() {
        return of(System.err);
    }

    /** Drops everything. */
    static LogSink discard() {
        return text -> {};
    }
}
