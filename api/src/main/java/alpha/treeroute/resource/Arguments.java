package alpha.treeroute.resource;

import alpha.treeroute.message.Request;

import java.util.Map;

/**
 * The bound arguments of a page or locator invocation.<p>
 * 
 * There is one value for each declared parameter, even if the value is
 * {@code null} (a default may be {@code null}). A {@code VAR_POSITIONAL}
 * parameter has a {@code List} value and a {@code VAR_KEYWORD} parameter has
 * a {@code Map<String, String>} value.
 * 
 * <pre>{@code
 *   Page greet = Page.builder()
 *       .param(Parameter.positional("name"))
 *       .param(Parameter.keywordOnly("times", Integer::valueOf).withDefault(1))
 *       .supply(args -> {
 *           String name = args.getAny("name");
 *           int times = args.getAny("times");
 *           return ("Hello " + name + "! ").repeat(times);
 *       });
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Arguments
{
    /**
     * Returns the value of the given parameter.
     * 
     * @param name of parameter
     * 
     * @return the value (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if no such parameter was declared
     */
    Object get(String name);
    
    /**
     * Returns the value of the given parameter cast to V.<p>
     * 
     * The call site will blow up with a {@code ClassCastException} if a
     * non-null value is not assignable to the inferred type.
     * 
     * @param <V> value type
     * @param name of parameter
     * 
     * @return the value (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if no such parameter was declared
     */
    <V> V getAny(String name);
    
    /**
     * Returns a copy of these arguments with the given value replaced.<p>
     * 
     * This object is not modified. Useful for an {@link AroundHook} that
     * proceeds with a value of its own.
     * 
     * @param name of parameter
     * @param value new value (may be {@code null})
     * 
     * @return a new arguments object
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if no such parameter was declared
     */
    Arguments with(String name, Object value);
    
    /**
     * Returns all values keyed by parameter name, in declaration order.
     * 
     * @return all values (unmodifiable)
     */
    Map<String, Object> asMap();
    
    /**
     * Returns the request being resolved.
     * 
     * @return the request being resolved
     */
    Request request();
}
