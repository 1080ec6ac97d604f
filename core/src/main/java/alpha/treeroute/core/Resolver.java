package alpha.treeroute.core;

import alpha.treeroute.NotFoundException;
import alpha.treeroute.resource.Invocable;
import alpha.treeroute.resource.Resource;
import alpha.treeroute.resource.ShortCircuit;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;

import static alpha.treeroute.core.Binder.Mode.PARTIAL;
import static alpha.treeroute.core.Binder.Mode.STRICT;
import static java.lang.System.Logger.Level.DEBUG;
import static java.text.MessageFormat.format;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;

/**
 * Walks the path segments of a request against a resource tree.<p>
 * 
 * The resolution is a state machine. {@link #step(State, ResolutionContext)}
 * is a synchronous transition function, and {@link
 * #resolve(Resource, ResolutionContext)} drives it from a root until the
 * result is known. The only asynchronous transition is out of {@link
 * Invoking}, which waits on the stage returned by the invoked page or
 * locator.
 * 
 * <ul>
 *   <li>{@code Descending} selects a member of a resource. A child resource
 *       yields another {@code Descending}. A page or locator is bound and
 *       yields {@code Invoking}. Nothing selected, or a failed binding,
 *       yields {@code Failed}.</li>
 *   <li>{@code Invoking} a page yields {@code Succeeded}. Invoking a locator
 *       yields {@code Redescending} into the resource it produced.</li>
 *   <li>{@code Redescending} continues as {@code Descending} with the
 *       segments the locator left over.</li>
 * </ul>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Resolver
{
    private static final System.Logger LOG
            = System.getLogger(Resolver.class.getPackageName());
    
    private Resolver() {
        // Empty
    }
    
    /** A state of the resolution. */
    sealed interface State
            permits Descending, Invoking, Redescending, Succeeded, Failed {
        // Empty
    }
    
    /**
     * At a resource, about to select a member for the segment at the given
     * position.
     * 
     * @param at resource
     * @param pos of next segment
     */
    record Descending(Resource at, int pos) implements State {
        // Empty
    }
    
    /**
     * About to invoke a page or locator.
     * 
     * @param target to invoke
     * @param args bound arguments
     * @param locates {@code true} if the target is a locator
     * @param resumeAt position of the next segment, should the target yield a
     *                 resource
     */
    record Invoking(Invocable target, DefaultArguments args, boolean locates, int resumeAt)
            implements State {
        // Empty
    }
    
    /**
     * A locator yielded a resource.
     * 
     * @param into resource
     * @param pos of next segment
     */
    record Redescending(Resource into, int pos) implements State {
        // Empty
    }
    
    /**
     * The result is known.
     * 
     * @param value result
     */
    record Succeeded(Object value) implements State {
        // Empty
    }
    
    /**
     * The request could not be resolved.
     * 
     * @param reason diagnostic message
     */
    record Failed(String reason) implements State {
        // Empty
    }
    
    /**
     * Resolves the request from the given root.<p>
     * 
     * The returned stage completes with the result, or exceptionally with a
     * {@code NotFoundException}, an application error or a {@code
     * CancellationException}. The exception may be wrapped in a {@code
     * CompletionException}.
     * 
     * @param root to start at
     * @param ctx of resolution
     * 
     * @return the result
     */
    static CompletionStage<Object> resolve(Resource root, ResolutionContext ctx) {
        return run(new Descending(root, 0), ctx);
    }
    
    private static CompletionStage<Object> run(State s, ResolutionContext ctx) {
        for (;;) {
            if (ctx.isCancelled()) {
                return failedStage(new CancellationException());
            }
            if (s instanceof Succeeded ok) {
                return completedStage(ok.value());
            }
            if (s instanceof Failed f) {
                ctx.trace(f::reason);
                LOG.log(DEBUG, () -> "Resolution failed: " + f.reason());
                return failedStage(new NotFoundException(ctx.segments(), ctx.trace()));
            }
            if (s instanceof Invoking inv) {
                return invoke(inv, ctx);
            }
            try {
                s = step(s, ctx);
            } catch (RuntimeException e) {
                // From a converter or a resource's members()
                return failedStage(e);
            }
        }
    }
    
    private static CompletionStage<Object> invoke(Invoking inv, ResolutionContext ctx) {
        final CompletionStage<?> stage;
        try {
            stage = inv.target().invoke(inv.args());
        } catch (RuntimeException e) {
            return failedStage(e);
        }
        if (stage == null) {
            return failedStage(new NullPointerException(
                    "Invocation returned null: " + inv.target()));
        }
        ctx.inFlight(stage);
        return stage.thenCompose(v -> run(resume(inv, v, ctx), ctx));
    }
    
    /**
     * Transitions out of a non-terminal, synchronous state.
     * 
     * @param s state ({@code Descending} or {@code Redescending})
     * @param ctx of resolution
     * 
     * @return the next state
     * 
     * @throws IllegalArgumentException
     *             if {@code s} is not {@code Descending} or {@code Redescending}
     * @throws RuntimeException
     *             from application code, e.g. a converter
     */
    static State step(State s, ResolutionContext ctx) {
        if (s instanceof Redescending r) {
            return new Descending(r.into(), r.pos());
        }
        if (!(s instanceof Descending d)) {
            throw new IllegalArgumentException("Not a synchronous state: " + s);
        }
        
        final var segs = ctx.segments();
        final var sel = Selector.select(d.at().members(), segs, d.pos());
        if (sel.isEmpty()) {
            return new Failed(d.pos() == segs.size() ?
                    "No index at the end of the path." :
                    format("\"{0}\" matched no member and there is no default.",
                           segs.get(d.pos())));
        }
        
        final var it = sel.get();
        ctx.trace(() -> d.pos() == segs.size() ?
                format("End of path selects {0}", it.kind()) :
                format("\"{0}\" selects {1}", segs.get(d.pos()), it.kind()));
        
        if (it.kind() == Selector.Kind.CHILD) {
            return new Descending(it.child(), it.offset());
        }
        
        final Binder.Bound b;
        try {
            b = Binder.bind(it.invocable(), it.positional(segs), ctx.request(),
                            it.locates() ? PARTIAL : STRICT);
        } catch (BindingException e) {
            return new Failed(e.getMessage());
        }
        
        if (it.locates() && it.kind() == Selector.Kind.DEFAULT_LOCATOR && b.consumed() == 0) {
            // Would select the same default again, forever
            return new Failed("Default locator took no positional value.");
        }
        
        return new Invoking(it.invocable(), b.args(), it.locates(), it.offset() + b.consumed());
    }
    
    /**
     * Transitions out of {@code Invoking}, given the result of the
     * invocation.
     * 
     * @param inv state
     * @param result of invocation
     * @param ctx of resolution
     * 
     * @return the next state
     */
    static State resume(Invoking inv, Object result, ResolutionContext ctx) {
        if (!inv.locates()) {
            return new Succeeded(result);
        }
        if (result instanceof ShortCircuit sc) {
            ctx.trace(() -> "Locator short-circuited");
            return new Succeeded(sc.value());
        }
        if (result == null) {
            return new Failed("Locator yielded null.");
        }
        if (result instanceof Resource r) {
            ctx.trace(() -> "Locator yielded " + r.getClass().getSimpleName());
            return new Redescending(r, inv.resumeAt());
        }
        // Produced by an around-hook
        return new Succeeded(result);
    }
}
