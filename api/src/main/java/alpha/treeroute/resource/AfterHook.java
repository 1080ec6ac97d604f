package alpha.treeroute.resource;

import java.util.concurrent.CompletionStage;

/**
 * Transforms the result of a page.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Page.Builder#after(AfterHook)
 */
@FunctionalInterface
public interface AfterHook
{
    /**
     * Runs the hook.
     * 
     * @param args bound arguments
     * @param result of the body, a before-hook, or a previous after-hook
     * 
     * @return the new result
     */
    CompletionStage<Object> apply(Arguments args, Object result);
}
