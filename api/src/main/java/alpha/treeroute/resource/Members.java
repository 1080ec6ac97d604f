package alpha.treeroute.resource;

import java.util.Optional;
import java.util.Set;

/**
 * The members of a {@link Resource}.<p>
 * 
 * A resource has any number of named members, each of which is a {@link
 * Page}, a child {@link Resource} or a {@link Locator}. A name is unique
 * across all three. A path segment selects a member by exact, case-sensitive
 * equality.<p>
 * 
 * There are also two slots:
 * 
 * <ul>
 *   <li>{@code index}, a page selected when no segment remains. It never
 *       receives positional values.</li>
 *   <li>{@code default}, a page or a locator selected when a segment
 *       matches no named member. It receives the unmatched segment as its
 *       first positional value.</li>
 * </ul>
 * 
 * The slots are not named members. A segment equal to "index" or "default"
 * does not select a slot.<p>
 * 
 * Members are immutable.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Members
{
    /**
     * Name of the index slot.
     */
    String INDEX = "index";
    
    /**
     * Name of the default slot.
     */
    String DEFAULT = "default";
    
    /**
     * Returns a new builder of members.
     * 
     * @return a new builder of members
     */
    static Builder builder() {
        return new DefaultMembers.Builder();
    }
    
    /**
     * Returns the page of the given name.
     * 
     * @param name of page
     * 
     * @return the page of the given name (never {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<Page> page(String name);
    
    /**
     * Returns the child resource of the given name.
     * 
     * @param name of child
     * 
     * @return the child resource of the given name (never {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<Resource> child(String name);
    
    /**
     * Returns the locator of the given name.
     * 
     * @param name of locator
     * 
     * @return the locator of the given name (never {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<Locator> locator(String name);
    
    /**
     * Returns the page in the index slot.
     * 
     * @return the page in the index slot (never {@code null})
     */
    Optional<Page> index();
    
    /**
     * Returns the page or locator in the default slot.
     * 
     * @return the page or locator in the default slot (never {@code null})
     */
    Optional<Invocable> fallback();
    
    /**
     * Returns the names of all named members, in registration order.
     * 
     * @return the names of all named members (unmodifiable)
     */
    Set<String> names();
    
    /**
     * Builder of {@link Members}.<p>
     * 
     * The builder is not thread-safe and is intended to be used as a
     * throw-away object.<p>
     * 
     * A name must not be blank and must not contain a forward slash, as it
     * could then never equal a path segment. The names {@value Members#INDEX} and
     * {@value Members#DEFAULT} are reserved for the slots; registering a page using
     * one of them is the same as putting the page in the slot.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Registers a page.
         * 
         * @param name of page
         * @param page to register
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} is invalid, or the page is invalid for
         *             the slot {@code name} refers to
         * @throws MemberCollisionException
         *             if {@code name} is already taken
         */
        Builder page(String name, Page page);
        
        /**
         * Registers a child resource.
         * 
         * @param name of child
         * @param child to register
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} is invalid or refers to a slot
         * @throws MemberCollisionException
         *             if {@code name} is already taken
         */
        Builder child(String name, Resource child);
        
        /**
         * Registers a locator.<p>
         * 
         * The name {@value Members#DEFAULT} puts the locator in the default slot.
         * 
         * @param name of locator
         * @param locator to register
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} is invalid or is {@value Members#INDEX}
         * @throws MemberCollisionException
         *             if {@code name} is already taken
         */
        Builder locator(String name, Locator locator);
        
        /**
         * Puts a page in the index slot.
         * 
         * @param page to put
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException
         *             if {@code page} is {@code null}
         * @throws IllegalArgumentException
         *             if {@code page} declares a {@code VAR_POSITIONAL} parameter
         * @throws MemberCollisionException
         *             if the slot is already taken
         */
        Builder index(Page page);
        
        /**
         * Puts a page in the default slot.
         * 
         * @param page to put
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException
         *             if {@code page} is {@code null}
         * @throws IllegalArgumentException
         *             if {@code page} declares no positional parameter
         * @throws MemberCollisionException
         *             if the slot is already taken
         */
        Builder fallback(Page page);
        
        /**
         * Puts a locator in the default slot.
         * 
         * @param locator to put
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException
         *             if {@code locator} is {@code null}
         * @throws IllegalArgumentException
         *             if {@code locator} declares no positional parameter
         * @throws MemberCollisionException
         *             if the slot is already taken
         */
        Builder fallback(Locator locator);
        
        /**
         * Builds the members.
         * 
         * @return the members
         */
        Members build();
    }
}
