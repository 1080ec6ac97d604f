package alpha.treeroute.resource;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Runs before-, around- and after-hooks around a body.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Hooks
{
    private Hooks() {
        // Empty
    }
    
    /**
     * Runs the hooks and body in order.<p>
     * 
     * The returned stage is the body's own stage if there are no hooks.
     * 
     * @param before hooks
     * @param around hooks, first is outermost
     * @param body of invocable
     * @param after hooks
     * @param args bound arguments
     * @param markShortCircuit wrap a before-hook's value in {@link ShortCircuit}
     * 
     * @return the final result
     */
    static CompletionStage<?> around(
            List<BeforeHook> before,
            List<AroundHook> around,
            Function<? super Arguments, ? extends CompletionStage<?>> body,
            List<AfterHook> after,
            Arguments args,
            boolean markShortCircuit)
    {
        var inner = nest(around, 0, body);
        if (before.isEmpty() && after.isEmpty()) {
            return inner.apply(args);
        }
        CompletionStage<Object> stage = before(before, 0, args).thenCompose(opt -> {
            if (opt.isPresent()) {
                return completedStage(markShortCircuit ?
                        new ShortCircuit(opt.get()) : opt.get());
            }
            return widen(inner.apply(args));
        });
        for (AfterHook h : after) {
            stage = stage.thenCompose(r -> h.apply(args, r));
        }
        return stage;
    }
    
    private static Function<? super Arguments, ? extends CompletionStage<?>> nest(
            List<AroundHook> hooks, int i,
            Function<? super Arguments, ? extends CompletionStage<?>> body)
    {
        if (i == hooks.size()) {
            return body;
        }
        AroundHook h = hooks.get(i);
        Function<? super Arguments, ? extends CompletionStage<?>> next = nest(hooks, i + 1, body);
        return args -> h.apply(args, next);
    }
    
    @SuppressWarnings("unchecked")
    private static CompletionStage<Object> widen(CompletionStage<?> stage) {
        return (CompletionStage<Object>) stage;
    }
    
    private static CompletionStage<Optional<Object>> before(
            List<BeforeHook> hooks, int i, Arguments args) {
        if (i == hooks.size()) {
            return completedStage(Optional.empty());
        }
        return hooks.get(i).apply(args).thenCompose(opt -> {
            if (opt.isPresent()) {
                return completedStage(opt);
            }
            return before(hooks, i + 1, args);
        });
    }
}
