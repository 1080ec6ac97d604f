package alpha.treeroute;

import java.util.List;

import static java.util.stream.Collectors.joining;
import static java.util.stream.StreamSupport.stream;

/**
 * Thrown when a request path could not be resolved into a result.<p>
 * 
 * The reasons include a segment that names no member, a missing {@code index}
 * or {@code default} slot, a parameter that could not be bound or failed
 * conversion, and a path exceeding {@link Config#maxPathSegments()}. A page
 * body may also throw this exception itself, for example when a requested
 * entity does not exist.<p>
 * 
 * The message is always the request path, and nothing else. Why a
 * particular request failed is recorded in the {@link #trace() trace}, which
 * is meant for logs, not for a client. A transport will typically map this
 * exception to a "404 Not Found" response.<p>
 * 
 * {@link Site} reacts to this exception by trying the next root resource.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class NotFoundException extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    
    private final transient List<String> segments;
    private final transient List<String> trace;
    
    /**
     * Constructs a {@code NotFoundException}.
     * 
     * @param pathSegments of request (normalized and percent-decoded)
     * 
     * @throws NullPointerException if {@code pathSegments} is {@code null}
     */
    public NotFoundException(Iterable<String> pathSegments) {
        this(pathSegments, List.of());
    }
    
    /**
     * Constructs a {@code NotFoundException}.
     * 
     * @param pathSegments of request (normalized and percent-decoded)
     * @param trace of resolution steps (copied)
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public NotFoundException(Iterable<String> pathSegments, List<String> trace) {
        super(path(pathSegments));
        this.segments = stream(pathSegments.spliterator(), false).toList();
        this.trace = List.copyOf(trace);
    }
    
    /**
     * Returns the path segments of the request.
     * 
     * @return the path segments of the request (unmodifiable)
     */
    public List<String> getSegments() {
        return segments;
    }
    
    /**
     * Returns the request path, e.g. "/forum/12".
     * 
     * @return the request path (never {@code null} or the empty string)
     */
    public String getPath() {
        return path(segments);
    }
    
    /**
     * Returns the resolution steps that led to this exception.<p>
     * 
     * The list is empty if tracing is {@link Config#traceResolution()
     * disabled}, or if the exception was thrown by application code.
     * 
     * @return the resolution steps (unmodifiable)
     */
    public List<String> trace() {
        return trace;
    }
    
    private static String path(Iterable<String> pathSegments) {
        return "/" + stream(pathSegments.spliterator(), false).collect(joining("/"));
    }
}
