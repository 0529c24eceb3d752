package io.fakegateway.core.worker.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fakegateway.core.ipc.EventMessage;
import io.fakegateway.core.ipc.IpcChannel;
import io.fakegateway.core.ipc.IpcCodec;
import java.lang.reflect.InvocationTargetException;

/**
 * Entry point of a worker process: {@code WorkerMain <entry> <handler>}.
 *
 * <p>
 * Connects to the gateway on the port in {@value IpcChannel#PORT_ENV}, reads one event, runs the
 * handler and answers with one result message. Anything the handler throws is printed to stderr
 * and the process exits with status 1, which the gateway reports as a crash. Runs outside the
 * gateway JVM, so it writes diagnostics to stderr instead of a logger.
 */
public final class WorkerMain {

    static final int EXIT_OK = 0;
    static final int EXIT_HANDLER_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private WorkerMain() {
        // entry point
    }

    /**
     * Worker entry point.
     *
     * @param args entry class name and handler method name
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2) {
            System.err.println("usage: WorkerMain <entry> <handler>");
            return EXIT_USAGE;
        }
        String port = System.getenv(IpcChannel.PORT_ENV);
        if (port == null || port.isBlank()) {
            System.err.println(IpcChannel.PORT_ENV + " is not set; workers must be started by the gateway");
            return EXIT_USAGE;
        }

        ObjectMapper mapper = new ObjectMapper();
        IpcCodec codec = new IpcCodec(mapper);
        try (IpcChannel channel = IpcChannel.connect(Integer.parseInt(port))) {
            EventMessage message = codec.decodeEvent(channel.receive());
            HandlerInvoker invoker = HandlerInvoker.load(mapper, args[0], args[1]);
            JsonNode result = invoker.invoke(message.eventObject());
            Runtime runtime = Runtime.getRuntime();
            channel.send(codec.encodeResult(message.id(), result, runtime.totalMemory() - runtime.freeMemory()));
            return EXIT_OK;
        } catch (InvocationTargetException e) {
            e.getCause().printStackTrace();
            return EXIT_HANDLER_FAILED;
        } catch (Exception e) {
            e.printStackTrace();
            return EXIT_HANDLER_FAILED;
        }
    }
}
