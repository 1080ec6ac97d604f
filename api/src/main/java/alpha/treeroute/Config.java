package alpha.treeroute;

/**
 * Site configuration.<p>
 * 
 * Values are immutable. {@link #toBuilder()} returns a builder primed with
 * the values of the called configuration, so that a new configuration can be
 * derived from an old one:
 * 
 * <pre>{@code
 *   Config config = Config.DEFAULT.toBuilder()
 *                                 .maxPathSegments(16)
 *                                 .build();
 *   Site site = Site.create(config, new MyRoot());
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * Values used: <p>
     * 
     * Max path segments = 64<br>
     * Max path rewrites = 10<br>
     * Trace resolution = true
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns the maximum number of path segments a request may have.<p>
     * 
     * A request with more segments resolves to {@link NotFoundException}
     * without touching the resource tree.<p>
     * 
     * The default value is 64.
     * 
     * @return the maximum number of path segments a request may have
     */
    int maxPathSegments();
    
    /**
     * Returns the maximum number of times a request may be rewritten by a
     * {@link PathRewriteException}.<p>
     * 
     * One more rewrite completes the resolution exceptionally with an {@code
     * IllegalStateException}, as the application is likely rewriting in a
     * loop.<p>
     * 
     * The default value is 10.
     * 
     * @return the maximum number of times a request may be rewritten
     */
    int maxPathRewrites();
    
    /**
     * Returns whether to record a trace of the resolution steps.<p>
     * 
     * The trace is carried by {@link NotFoundException#trace()} and printed in
     * the log on level {@code DEBUG}. A site serving high traffic where the
     * diagnostic value is not needed may disable it.<p>
     * 
     * The default value is {@code true}.
     * 
     * @return whether to record a trace of the resolution steps
     */
    boolean traceResolution();
    
    /**
     * Returns a builder pre-populated with the values of this configuration.
     * 
     * @return a builder pre-populated with the values of this configuration
     */
    Builder toBuilder();
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder is immutable, each setter returns a new instance.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         * 
         * @throws IllegalArgumentException if {@code newVal} is less than 0
         * 
         * @see Config#maxPathSegments()
         */
        Builder maxPathSegments(int newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         * 
         * @throws IllegalArgumentException if {@code newVal} is less than 0
         * 
         * @see Config#maxPathRewrites()
         */
        Builder maxPathRewrites(int newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         * 
         * @see Config#traceResolution()
         */
        Builder traceResolution(boolean newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return a configuration
         */
        Config build();
    }
}
