package io.buildqueue4j;

@FunctionalInterface
public interface JobFunction<T> {
    T apply(ProgressSink progress) throws Exception;
}
