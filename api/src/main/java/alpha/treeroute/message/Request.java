package alpha.treeroute.message;

import alpha.treeroute.Site;

import java.util.List;

/**
 * The input of a resolution.<p>
 * 
 * A request is created by a transport and given to {@link
 * Site#resolve(Request)}. It has three parts:
 * 
 * <ul>
 *   <li>The path segments, already normalized and percent-decoded. The
 *       resolver consumes them one at a time.</li>
 *   <li>The named values, sourced from the query string and any form body.
 *       They are bound to page parameters by name.</li>
 *   <li>Attributes, which are opaque to the resolver.</li>
 * </ul>
 * 
 * A request created from a raw request target:
 * <pre>{@code
 *   Request r = Request.parse("/forum/12/topic/10?offset=20&num=20");
 *   r.segments();               // [forum, 12, topic, 10]
 *   r.namedValues().get("num"); // Optional[20]
 * }</pre>
 * 
 * A transport that also parsed a form body:
 * <pre>{@code
 *   Request r = Request.builder()
 *                      .target(rawTarget)
 *                      .body(NamedValues.parse(formBody))
 *                      .attribute("my.exchange", exchange)
 *                      .build();
 * }</pre>
 * 
 * The segments and named values are immutable. The attributes are mutable
 * and thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Request
{
    /**
     * Creates a request from a raw request target.<p>
     * 
     * This method is equivalent to:
     * <pre>
     *   Request.{@link #builder() builder}().{@link Builder#target(String)
     *     target}(requestTarget).build();
     * </pre>
     * 
     * @param requestTarget e.g. "/hello/John?greeting=hi"
     * 
     * @return a new request
     * 
     * @throws NullPointerException
     *             if {@code requestTarget} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code requestTarget} has a malformed percent-escape
     */
    static Request parse(String requestTarget) {
        return builder().target(requestTarget).build();
    }
    
    /**
     * Returns a builder of an empty request.
     * 
     * @return a builder of an empty request
     */
    static Builder builder() {
        return DefaultRequest.DefaultBuilder.ROOT;
    }
    
    /**
     * Returns the path segments.<p>
     * 
     * The root path "/" has no segments.
     * 
     * @return the path segments (unmodifiable)
     */
    List<String> segments();
    
    /**
     * Returns the path, which is "/" followed by the segments joined with
     * "/".
     * 
     * @return the path (never {@code null} or the empty string)
     */
    String path();
    
    /**
     * Returns the named values.<p>
     * 
     * Values from a form body are ordered after values from the query
     * string, so for a name present in both, the body's value is returned
     * by {@link NamedValues#get(String)}.
     * 
     * @return the named values
     */
    NamedValues namedValues();
    
    /**
     * Returns the attributes of this request.
     * 
     * @return the attributes of this request
     */
    Attributes attributes();
    
    /**
     * Returns a request for a new request target.<p>
     * 
     * The returned request has the segments and query values of the given
     * target. It keeps the form body values of this request, and shares the
     * attributes of this request.
     * 
     * @param requestTarget e.g. "/forums"
     * 
     * @return a new request
     * 
     * @throws NullPointerException
     *             if {@code requestTarget} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code requestTarget} has a malformed percent-escape
     * 
     * @see alpha.treeroute.PathRewriteException
     */
    Request rewrite(String requestTarget);
    
    /**
     * Builder of a {@link Request}.<p>
     * 
     * The builder is immutable, each method returns a new instance. Methods
     * may be called in any order.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Sets the segments and the query values from a raw request target.
         * 
         * @param requestTarget raw request target
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code requestTarget} is {@code null}
         * @throws IllegalArgumentException
         *             if {@code requestTarget} has a malformed percent-escape
         */
        Builder target(String requestTarget);
        
        /**
         * Sets the path segments.<p>
         * 
         * The segments are used as is, no normalization or decoding is done.
         * 
         * @param segments of path
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code segments} or an element is {@code null}
         */
        Builder segments(List<String> segments);
        
        /**
         * Sets the query values.
         * 
         * @param query values
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if {@code query} is {@code null}
         */
        Builder query(NamedValues query);
        
        /**
         * Sets the form body values, which are appended after the query
         * values.
         * 
         * @param body values
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if {@code body} is {@code null}
         */
        Builder body(NamedValues body);
        
        /**
         * Adds an attribute.
         * 
         * @param name of attribute
         * @param value of attribute
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if any argument is {@code null}
         */
        Builder attribute(String name, Object value);
        
        /**
         * Builds the request.<p>
         * 
         * Each call returns a new request with its own attributes.
         * 
         * @return a new request
         */
        Request build();
    }
}
