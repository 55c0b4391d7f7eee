package io.shuttle.client;

import io.shuttle.core.Request;
import io.shuttle.core.Response;

import java.util.List;
import java.util.Objects;

/**
 * A middleware list compiled into a single callable chain.
 *
 * <p>The list is folded from its last element to its first around the kernel, so that middleware
 * run in declared order on the way in and see responses in reverse order on the way out.
 */
public final class MiddlewarePipeline {

    private final List<Middleware> layers;
    private final Middleware.Next chain;

    private MiddlewarePipeline(List<Middleware> layers, Middleware.Next chain) {
        this.layers = layers;
        this.chain = chain;
    }

    /**
     * Compiles {@code layers} around {@code kernel}.
     *
     * @param layers middleware in execution order
     * @param kernel the terminal stage, usually {@link Transport#execute(Request)}
     * @return the compiled pipeline
     */
    public static MiddlewarePipeline compile(List<Middleware> layers, Middleware.Next kernel) {
        Objects.requireNonNull(kernel, "kernel");
        List<Middleware> copy = List.copyOf(layers);

        Middleware.Next chain = kernel;
        for (int i = copy.size() - 1; i >= 0; i--) {
            Middleware middleware = copy.get(i);
            Middleware.Next next = chain;
            chain = request -> middleware.process(request, next);
        }
        return new MiddlewarePipeline(copy, chain);
    }

    /**
     * Runs {@code request} through every layer and the kernel.
     */
    public Response handle(Request request) {
        return chain.handle(request);
    }

    public List<Middleware> layers() {
        return layers;
    }
}
