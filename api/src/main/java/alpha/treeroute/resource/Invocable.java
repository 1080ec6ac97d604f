package alpha.treeroute.resource;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * A member of a resource that the resolver invokes with bound arguments;
 * a {@link Page} or a {@link Locator}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Invocable
{
    /**
     * Returns the declared parameters, in binding order.
     * 
     * @return the declared parameters (unmodifiable)
     */
    List<Parameter> parameters();
    
    /**
     * Invokes this member.<p>
     * 
     * Any exception thrown, or failure of the returned stage, is an
     * application error, except for a {@code NotFoundException}.
     * 
     * @param args bound arguments
     * 
     * @return the result
     */
    CompletionStage<?> invoke(Arguments args);
}
