package alpha.treeroute.core;

import alpha.treeroute.message.Request;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * State of one resolution, shared by all roots tried.<p>
 * 
 * Steps of a resolution are executed one at a time, but not necessarily by
 * the same thread.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ResolutionContext
{
    private volatile Request request;
    private volatile int rewrites;
    private final List<String> trace;
    private volatile boolean cancelled;
    private volatile CompletionStage<?> inFlight;
    
    /**
     * Constructs a {@code ResolutionContext}.
     * 
     * @param request being resolved
     * @param trace {@code true} if steps should be recorded
     */
    ResolutionContext(Request request, boolean trace) {
        this.request = request;
        this.trace = trace ? new ArrayList<>() : null;
    }
    
    Request request() {
        return request;
    }
    
    List<String> segments() {
        return request.segments();
    }
    
    /**
     * Replaces the request being resolved.<p>
     * 
     * The trace and cancellation state carry over to the new request.
     * 
     * @param next request
     */
    void rewrite(Request next) {
        request = next;
        ++rewrites;
    }
    
    /**
     * Returns the number of times the request has been rewritten.
     * 
     * @return the number of times the request has been rewritten
     */
    int rewrites() {
        return rewrites;
    }
    
    /**
     * Records a step, if tracing is enabled.
     * 
     * @param step description
     */
    void trace(Supplier<String> step) {
        if (trace != null) {
            synchronized (trace) {
                trace.add(step.get());
            }
        }
    }
    
    /**
     * Returns a copy of the recorded steps.
     * 
     * @return a copy of the recorded steps (empty if tracing is disabled)
     */
    List<String> trace() {
        if (trace == null) {
            return List.of();
        }
        synchronized (trace) {
            return List.copyOf(trace);
        }
    }
    
    /**
     * Registers the stage of an invocation in progress.<p>
     * 
     * If the resolution has already been cancelled, the stage is cancelled
     * immediately.
     * 
     * @param stage of invocation
     */
    void inFlight(CompletionStage<?> stage) {
        inFlight = stage;
        if (cancelled) {
            cancel(stage);
        }
    }
    
    /**
     * Cancels the resolution.<p>
     * 
     * The resolver will not take another step, and the stage of an
     * invocation in progress is cancelled if it is a {@code Future}.
     */
    void cancel() {
        cancelled = true;
        var s = inFlight;
        if (s != null) {
            cancel(s);
        }
    }
    
    boolean isCancelled() {
        return cancelled;
    }
    
    private static void cancel(CompletionStage<?> stage) {
        if (stage instanceof Future<?> f) {
            f.cancel(true);
        }
    }
}
