package alpha.treeroute.resource;

import static java.util.Objects.requireNonNull;

/**
 * The result of a locator whose {@link BeforeHook} short-circuited the
 * invocation.<p>
 * 
 * The value is the result of the resolution, even if it is a {@code Resource}
 * and even if segments remain.
 * 
 * @param value produced by the hook (never {@code null})
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record ShortCircuit(Object value) {
    /**
     * Initializes this object.
     * 
     * @param value produced by the hook
     * 
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public ShortCircuit {
        requireNonNull(value);
    }
}
