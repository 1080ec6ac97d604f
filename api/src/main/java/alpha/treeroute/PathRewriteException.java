package alpha.treeroute;

import alpha.treeroute.message.Request;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by application code to have the site resolve the request again,
 * using a new request target.<p>
 * 
 * The exception may be thrown by a page, locator, hook or converter, or be
 * the exceptional completion of the stage they return. The site then
 * replaces the request with {@link Request#rewrite(String)} and starts over
 * from the first root. The response is produced for the new target, no
 * redirect is sent to the client.
 * 
 * <pre>{@code
 *   Locator forum = Locator.builder()
 *       .param(Parameter.positional("id", Integer::valueOf).withDefault(null))
 *       .supply(args -> {
 *           Integer id = args.getAny("id");
 *           if (id == null) {
 *               throw new PathRewriteException("/forums");
 *           }
 *           return new Forum(id);
 *       });
 * }</pre>
 * 
 * The number of rewrites for one request is limited by {@link
 * Config#maxPathRewrites()}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class PathRewriteException extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    
    private final String requestTarget;
    
    /**
     * Constructs a {@code PathRewriteException}.
     * 
     * @param requestTarget new request target, e.g. "/forums?page=2"
     * 
     * @throws NullPointerException if {@code requestTarget} is {@code null}
     */
    public PathRewriteException(String requestTarget) {
        super("Rewrite to: " + requireNonNull(requestTarget));
        this.requestTarget = requestTarget;
    }
    
    /**
     * Returns the new request target.
     * 
     * @return the new request target
     */
    public String getRequestTarget() {
        return requestTarget;
    }
}
