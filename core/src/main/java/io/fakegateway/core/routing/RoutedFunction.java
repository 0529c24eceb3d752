package io.fakegateway.core.routing;

/** Anything registered under a path pattern. */
public interface RoutedFunction {

    /** The exact path or {@code prefix{name+}} proxy pattern this function is registered under. */
    String path();
}
