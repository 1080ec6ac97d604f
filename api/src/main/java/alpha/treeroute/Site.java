package alpha.treeroute;

import alpha.treeroute.message.Request;
import alpha.treeroute.resource.Resource;

import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.CompletionStage;
import java.util.stream.Stream;

import static java.util.concurrent.CompletableFuture.failedStage;

/**
 * An ordered list of root resources against which requests are resolved.<p>
 * 
 * The resolver consumes the request's path segments one at a time, starting
 * at a root. A segment naming a child resource descends into that child, a
 * segment naming a page invokes the page with the remaining segments as
 * positional values, and so on; see {@link
 * alpha.treeroute.resource.Members Members}. If a root fails to resolve the
 * request with a {@link NotFoundException}, the next root is tried. The first
 * root to resolve the request wins.
 * 
 * <pre>{@code
 *   Site site = Site.create(new Application(), new StaticFallback());
 *   site.resolve("/hello/John")
 *       .thenAccept(System.out::println);
 * }</pre>
 * 
 * A site is immutable and thread-safe. Many threads may resolve requests
 * concurrently.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Site
{
    /**
     * Creates a site using the {@link Config#DEFAULT default} configuration.
     * 
     * @param first root
     * @param more roots, tried in order after {@code first}
     * 
     * @return a new site
     * 
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     */
    static Site create(Resource first, Resource... more) {
        return create(Config.DEFAULT, first, more);
    }
    
    /**
     * Creates a site.
     * 
     * @param config of site
     * @param first root
     * @param more roots, tried in order after {@code first}
     * 
     * @return a new site
     * 
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     */
    static Site create(Config config, Resource first, Resource... more) {
        var loader = ServiceLoader.load(SiteFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config, first, more);
    }
    
    /**
     * Resolves the given request.<p>
     * 
     * The returned stage completes with the result of the page that was
     * invoked, or exceptionally with:
     * 
     * <ul>
     *   <li>{@link NotFoundException}, if no root could resolve the
     *       request, or</li>
     *   <li>the exception thrown by application code (page, locator, hook or
     *       converter) as is, not wrapped in a {@code
     *       CompletionException}. An application error stops the resolution,
     *       remaining roots are not tried.</li>
     * </ul>
     * 
     * The returned stage is a {@code CompletableFuture}. Cancelling it stops
     * the resolution and cancels the stage of a page in progress, if that
     * stage is a {@code Future}.
     * 
     * @param request to resolve
     * 
     * @return the result
     * 
     * @throws NullPointerException if {@code request} is {@code null}
     */
    CompletionStage<Object> resolve(Request request);
    
    /**
     * Resolves the given raw request target.<p>
     * 
     * A request target that can not be parsed, for example because of a
     * malformed percent-escape, resolves to a {@link NotFoundException}. The
     * exception's segments are the raw segments of the target, and its cause
     * is the parse failure.
     * 
     * @implSpec
     * The default implementation parses the target using {@link
     * Request#parse(String)} and calls {@link #resolve(Request)}.
     * 
     * @param requestTarget e.g. "/hello/John"
     * 
     * @return the result
     * 
     * @throws NullPointerException
     *             if {@code requestTarget} is {@code null}
     * 
     * @see #resolve(Request)
     */
    default CompletionStage<Object> resolve(String requestTarget) {
        final Request r;
        try {
            r = Request.parse(requestTarget);
        } catch (IllegalArgumentException e) {
            var nf = new NotFoundException(rawSegments(requestTarget));
            nf.initCause(e);
            return failedStage(nf);
        }
        return resolve(r);
    }
    
    private static List<String> rawSegments(String requestTarget) {
        int end = requestTarget.length();
        for (char c : new char[]{'?', '#'}) {
            int i = requestTarget.indexOf(c);
            if (i != -1 && i < end) {
                end = i;
            }
        }
        return Stream.of(requestTarget.substring(0, end).split("/"))
                .filter(s -> !s.isEmpty())
                .toList();
    }
    
    /**
     * Returns the roots, in the order they are tried.
     * 
     * @return the roots (unmodifiable)
     */
    List<Resource> roots();
    
    /**
     * Returns the configuration.
     * 
     * @return the configuration
     */
    Config config();
}
