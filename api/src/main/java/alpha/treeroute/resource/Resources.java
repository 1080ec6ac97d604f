package alpha.treeroute.resource;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Factories of {@link Resource}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Resources
{
    private Resources() {
        // Empty
    }
    
    /**
     * Returns a resource with the given members.
     * 
     * @param members of resource
     * 
     * @return a resource with the given members
     * 
     * @throws NullPointerException if {@code members} is {@code null}
     */
    public static Resource of(Members members) {
        requireNonNull(members);
        return () -> members;
    }
    
    /**
     * Returns a resource whose only members are the given child resources.<p>
     * 
     * Useful as a root that mounts independent applications on a path:
     * 
     * <pre>{@code
     *   Resource root = Resources.mapping(Map.of(
     *       "blog",  new Blog(),
     *       "forum", new ForumSite()));
     * }</pre>
     * 
     * @param children keyed by name
     * 
     * @return a resource with the given children
     * 
     * @throws NullPointerException
     *             if {@code children}, a key or a value is {@code null}
     * @throws IllegalArgumentException
     *             if a name is invalid, see {@link Members.Builder}
     */
    public static Resource mapping(Map<String, ? extends Resource> children) {
        var b = Members.builder();
        children.forEach(b::child);
        return of(b.build());
    }
}
