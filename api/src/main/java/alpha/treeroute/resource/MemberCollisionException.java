package alpha.treeroute.resource;

/**
 * Thrown by {@link Members.Builder} when an attempt is made to register a
 * member under a name, or in a slot, which is already taken.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class MemberCollisionException extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code MemberCollisionException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public MemberCollisionException(String message) {
        super(message);
    }
}
