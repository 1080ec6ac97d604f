package alpha.treeroute.resource;

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Wraps the body of a page or locator.<p>
 * 
 * The hook decides whether, and with which arguments, the invocation proceeds.
 * It may skip the body altogether and produce a result of its own, or it may
 * proceed with arguments that have been replaced using {@link
 * Arguments#with(String, Object)}. For example, a page that falls back to
 * rendering a form if a parameter is missing:
 * 
 * <pre>{@code
 *   AroundHook formIfMissing = (args, proceed) ->
 *       args.get("name") == null ? completedStage("form") : proceed.apply(args);
 * }</pre>
 * 
 * Hooks nest in the order they were added; the first hook added is the
 * outermost. All around-hooks run after the before-hooks and before the
 * after-hooks.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Page.Builder#around(AroundHook)
 * @see Locator.Builder#around(AroundHook)
 */
@FunctionalInterface
public interface AroundHook
{
    /**
     * Runs the hook.
     * 
     * @param args bound arguments
     * @param proceed the next hook, or the body
     * 
     * @return the result
     */
    CompletionStage<?> apply(
            Arguments args,
            Function<? super Arguments, ? extends CompletionStage<?>> proceed);
}
