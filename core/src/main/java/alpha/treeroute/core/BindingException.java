package alpha.treeroute.core;

/**
 * Thrown by {@link Binder} when the available values do not satisfy the
 * declared parameters.<p>
 * 
 * The exception never escapes the resolver; it becomes a
 * {@code NotFoundException}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class BindingException extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    
    BindingException(String message) {
        super(message, null, false, false);
    }
    
    BindingException(String message, Throwable cause) {
        super(message, cause, false, false);
    }
}
