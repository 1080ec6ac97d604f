package alpha.treeroute.resource;

/**
 * A node in the resource tree.<p>
 * 
 * A resource exposes its members: named pages, child resources and locators,
 * and the {@code index} and {@code default} slots. The members are expected
 * to be built once, when the resource is constructed, and never change.
 * 
 * <pre>{@code
 *   class Root implements Resource {
 *       private final Members members = Members.builder()
 *           .index(Page.builder().respond("Welcome"))
 *           .page("hello", Page.builder()
 *               .param(Parameter.positional("name"))
 *               .supply(args -> "Hello " + args.get("name")))
 *           .child("admin", new Admin())
 *           .build();
 *       
 *       public Members members() {
 *           return members;
 *       }
 *   }
 * }</pre>
 * 
 * A resource that has no need for a class of its own can be created with
 * {@link Resources#of(Members)}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Resource
{
    /**
     * Returns the members of this resource.<p>
     * 
     * The resolver calls this method at least once per visit, so the
     * implementation should return a pre-built object.
     * 
     * @return the members of this resource
     */
    Members members();
}
