package io.fakegateway.core.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;

/** Formats the log lines a real Lambda runtime prints around each invocation. */
final class LambdaLogLines {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long MEGABYTE = 1024L * 1024L;

    private LambdaLogLines() {
        // utility class
    }

    static String start(String id) {
        return "START\tRequestId:" + id + "\tVersion:$LATEST\n";
    }

    static String end(String id) {
        return "END\tRequestId: " + id + "\n";
    }

    static String report(String id, long durationMs, long memoryUsedBytes) {
        return "REPORT\tRequestId: " + id + "\t"
                + "InitDuration: 0 ms\t"
                + "Duration: " + durationMs + " ms\t"
                + "BilledDuration: " + durationMs + " ms\t"
                + "Memory Size: NaN MB MaxMemoryUsed " + Math.round((double) memoryUsedBytes / MEGABYTE) + " MB\n";
    }

    static String error(Instant startedAt, String id, List<String> stackLines) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("errorType", "Error");
        error.put("errorMessage", "Error");
        stackLines.forEach(error.putArray("stack")::add);
        try {
            return startedAt + "\t" + id + "\tERROR\t" + MAPPER.writeValueAsString(error) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Prefix for one line of function output. */
    static String output(String id, String severity, String line) {
        return Instant.now() + " " + id + " " + severity + " " + line + "\n";
    }
}
