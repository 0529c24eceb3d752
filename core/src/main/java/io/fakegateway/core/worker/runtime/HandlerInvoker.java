package io.fakegateway.core.worker.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;

/**
 * Resolves a function's entry and handler identifiers to a callable method.
 *
 * <p>
 * The entry is a fully qualified class name and the handler is the name of a public method on
 * it that takes exactly one argument. The event is converted to that argument's type with Jackson
 * (so {@link JsonNode}, {@code Map} or {@link io.fakegateway.core.model.LambdaEvent} all work), and
 * the return value is converted back to JSON. Instance methods are called on a new instance created
 * through the public no-argument constructor.
 */
public final class HandlerInvoker {

    private final ObjectMapper mapper;
    private final Object target;
    private final Method method;

    private HandlerInvoker(ObjectMapper mapper, Object target, Method method) {
        this.mapper = mapper;
        this.target = target;
        this.method = method;
    }

    /**
     * Loads the handler.
     *
     * @param mapper  mapper used for argument and result conversion
     * @param entry   fully qualified class name
     * @param handler public one-argument method name
     * @return the invoker
     * @throws ReflectiveOperationException if the class, method or constructor cannot be used
     */
    public static HandlerInvoker load(ObjectMapper mapper, String entry, String handler)
            throws ReflectiveOperationException {
        Class<?> type = Class.forName(entry, true, Thread.currentThread().getContextClassLoader());
        List<Method> candidates = Arrays.stream(type.getMethods())
                .filter(m -> m.getName().equals(handler) && m.getParameterCount() == 1)
                .toList();
        if (candidates.isEmpty()) {
            throw new NoSuchMethodException(
                    "No public one-argument method '" + handler + "' on " + entry);
        }
        if (candidates.size() > 1) {
            throw new NoSuchMethodException("Ambiguous handler '" + handler + "' on " + entry);
        }
        Method method = candidates.get(0);
        Object target = Modifier.isStatic(method.getModifiers())
                ? null
                : type.getDeclaredConstructor().newInstance();
        return new HandlerInvoker(mapper, target, method);
    }

    /**
     * Calls the handler.
     *
     * @param event the event object as received
     * @return the handler's return value as JSON
     * @throws InvocationTargetException wrapping anything the handler threw
     * @throws IllegalAccessException    if the method is not accessible
     */
    public JsonNode invoke(JsonNode event) throws InvocationTargetException, IllegalAccessException {
        Class<?> parameterType = method.getParameterTypes()[0];
        Object argument = JsonNode.class.isAssignableFrom(parameterType)
                ? event
                : mapper.convertValue(event, parameterType);
        Object result = method.invoke(target, argument);
        return mapper.valueToTree(result);
    }
}
