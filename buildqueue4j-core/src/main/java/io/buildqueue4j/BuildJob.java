package io.buildqueue4j;

/**
 * A named unit of work with a single-shot execution contract.
 *
 * <p>Names are not required to be unique.
 */
public interface BuildJob<T> {
    String name();

    T execute(ProgressSink progress) throws Exception;

    static <T> BuildJob<T> of(String name, JobFunction<T> function) {
        if (function == null) {
            throw new IllegalArgumentException("function must not be null");
        }
        return new BuildJob<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public T execute(ProgressSink progress) throws Exception {
                return function.apply(progress);
            }

            @Override
            public String toString() {
                return "BuildJob[" + name + "]";
            }
        };
    }
}
