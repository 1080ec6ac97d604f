package alpha.treeroute.message;

import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

/**
 * Objects associated with a request.<p>
 * 
 * Attributes carry data across boundaries the resolver knows nothing about.
 * A transport may attach its native request object before resolution, and a
 * before-hook may leave something behind for the page body:
 * 
 * <pre>{@code
 *   // In a before-hook
 *   args.request().attributes().set("my.user", user);
 *   // In the page body
 *   User user = args.request().attributes().getAny("my.user");
 * }</pre>
 * 
 * The implementation is thread-safe. Neither names nor values may be
 * {@code null}.<p>
 * 
 * The library reserves the namespace "alpha.treeroute.*". Applications are
 * encouraged to avoid using this prefix in their names.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Attributes
{
    /**
     * Returns the value of the named attribute as an object.
     * 
     * @param name of attribute
     * 
     * @return the value of the named attribute (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Object get(String name);
    
    /**
     * Sets the value of the named attribute.
     * 
     * @param name  of attribute
     * @param value of attribute
     * 
     * @return the old value (may be {@code null})
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    Object set(String name, Object value);
    
    /**
     * Returns the value of the named attribute cast to V.<p>
     * 
     * The cast is implicit and the type is inferred by the compiler. The call
     * site will blow up with a {@code ClassCastException} if a non-null value
     * is not assignable to the inferred type.
     * 
     * <pre>{@code
     *   request.attributes().set("name", "my string");
     *   
     *   // Okay
     *   String str = request.attributes().getAny("name");
     *   
     *   // ClassCastException
     *   Integer oops = request.attributes().getAny("name");
     * }</pre>
     * 
     * @param <V>  value type
     * @param name of attribute
     * 
     * @return the value of the named attribute (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    <V> V getAny(String name);
    
    /**
     * Returns the value of the named attribute as an {@code Optional}.
     * 
     * @param name of attribute
     * 
     * @return the value of the named attribute (never {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<Object> getOpt(String name);
    
    /**
     * Returns a modifiable map view of the attributes.<p>
     * 
     * Changes to the map are reflected in the attributes, and vice-versa.
     * 
     * @return a modifiable map view of the attributes
     */
    ConcurrentMap<String, Object> asMap();
}
