package alpha.treeroute.resource;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Runs before the body of a page or locator.<p>
 * 
 * The hook receives the bound arguments. An empty result lets the invocation
 * proceed to the next hook and eventually the body. A present value
 * short-circuits the invocation; the body will not run and the value becomes
 * the result.
 * 
 * <pre>{@code
 *   BeforeHook loggedIn = args ->
 *       completedStage(args.request().attributes().getOpt("my.user").isPresent() ?
 *           Optional.empty() : Optional.of(LOGIN_PAGE));
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Page.Builder#before(BeforeHook)
 * @see Locator.Builder#before(BeforeHook)
 */
@FunctionalInterface
public interface BeforeHook
{
    /**
     * Runs the hook.
     * 
     * @param args bound arguments
     * 
     * @return a value to short-circuit with, or empty to proceed
     */
    CompletionStage<Optional<Object>> apply(Arguments args);
}
