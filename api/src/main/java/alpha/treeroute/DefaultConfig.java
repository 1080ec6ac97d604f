package alpha.treeroute;

import alpha.treeroute.util.AbstractImmutableBuilder;

import java.util.function.Consumer;

/**
 * Default implementation of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config
{
    private final Builder builder;
    private final int     maxPathSegments,
                          maxPathRewrites;
    private final boolean traceResolution;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder         = b;
        maxPathSegments = s.maxPathSegments;
        maxPathRewrites = s.maxPathRewrites;
        traceResolution = s.traceResolution;
    }
    
    @Override
    public int maxPathSegments() {
        return maxPathSegments;
    }
    
    @Override
    public int maxPathRewrites() {
        return maxPathRewrites;
    }
    
    @Override
    public boolean traceResolution() {
        return traceResolution;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "maxPathSegments=" + maxPathSegments +
                ", maxPathRewrites=" + maxPathRewrites +
                ", traceResolution=" + traceResolution + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            int     maxPathSegments = 64,
                    maxPathRewrites = 10;
            boolean traceResolution = true;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder maxPathSegments(int newVal) {
            if (newVal < 0) {
                throw new IllegalArgumentException(
                        "Max path segments is negative: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.maxPathSegments = newVal);
        }
        
        @Override
        public Builder maxPathRewrites(int newVal) {
            if (newVal < 0) {
                throw new IllegalArgumentException(
                        "Max path rewrites is negative: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.maxPathRewrites = newVal);
        }
        
        @Override
        public Builder traceResolution(boolean newVal) {
            return new DefaultBuilder(this, s -> s.traceResolution = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
