package alpha.treeroute.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Base class for immutable builders.<p>
 * 
 * Each builder instance holds nothing but a reference to its predecessor and
 * one modification. Calling a setter never mutates the builder, it returns a
 * new builder linked to the one called. This makes every builder instance safe
 * to share and to branch from:
 * 
 * <pre>{@code
 *   Config.Builder base = Config.DEFAULT.toBuilder().maxPathSegments(10);
 *   Config a = base.traceResolution(false).build();
 *   Config b = base.build(); // unaffected by the previous line
 * }</pre>
 * 
 * When it is time to build, the chain is walked back to the root and the
 * modifications are replayed in the order they were made against a fresh
 * instance of the mutable state container, see {@link
 * #constructState(Supplier)}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S>
{
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs the root of a chain.
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a new link in the chain.
     * 
     * @param prev builder
     * @param modifier of the mutable state
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    protected AbstractImmutableBuilder(AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates a new state container and applies all modifications of the
     * chain, oldest first.<p>
     * 
     * The concrete builder's {@code build()} method is expected to call this
     * method and hand over the result to the built object. The built object
     * may copy the state or keep a reference to it, as long as it is never
     * exposed to code that could mutate it.
     * 
     * @param factory of the state container
     * 
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();
        
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }
        
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
