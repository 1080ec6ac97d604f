package alpha.treeroute.resource;

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * A terminal member of a resource, producing the result of a request.<p>
 * 
 * A page is registered on a resource under a name, or in the {@code index}
 * or {@code default} slot, see {@link Members.Builder}. Given the request
 * path "/hello/John" and a root resource with a page named "hello", the page
 * receives the remaining segment "John" as its first positional value. Every
 * positional value must be absorbed by a parameter, otherwise the request
 * resolves to {@code NotFoundException}.<p>
 * 
 * The result is an opaque object, for the transport to interpret.<p>
 * 
 * Build a page using {@link #builder()}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Page extends Invocable
{
    /**
     * Returns a new builder of a page.
     * 
     * @return a new builder of a page
     */
    static Builder builder() {
        return new DefaultPage.Builder();
    }
    
    /**
     * Builder of a {@link Page}.<p>
     * 
     * The builder is not thread-safe and is intended to be used as a
     * throw-away object. Each of the final methods ({@code apply}, {@code
     * supply} and {@code respond}) builds a new page.
     * 
     * <pre>{@code
     *   Page hello = Page.builder()
     *       .param(Parameter.positional("name").withDefault("World"))
     *       .supply(args -> "Hello " + args.get("name") + "!");
     *   
     *   Page slow = Page.builder()
     *       .apply(args -> fetchFromDatabaseAsync());
     *   
     *   Page robots = Page.builder()
     *       .respond("User-agent: *\nDisallow:");
     * }</pre>
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Declares a parameter.
         * 
         * @param param to declare
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException
         *             if {@code param} is {@code null}
         * @throws IllegalArgumentException
         *             if a parameter of the same name is already declared, or
         *             a variadic parameter of the same kind is already
         *             declared, or a positional parameter is declared after a
         *             variadic positional parameter
         */
        Builder param(Parameter param);
        
        /**
         * Declares parameters.
         * 
         * @implSpec
         * The default implementation calls {@link #param(Parameter)} for each
         * argument, in order.
         * 
         * @param params to declare
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException
         *             if {@code params} or an element is {@code null}
         * @throws IllegalArgumentException
         *             see {@link #param(Parameter)}
         */
        default Builder params(Parameter... params) {
            for (Parameter p : params) {
                param(p);
            }
            return this;
        }
        
        /**
         * Adds a hook that runs before the body.<p>
         * 
         * Hooks run in the order they were added. A value produced by a hook
         * is still passed through the after-hooks.
         * 
         * @param hook to add
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException if {@code hook} is {@code null}
         */
        Builder before(BeforeHook hook);
        
        /**
         * Adds a hook that wraps the body.<p>
         * 
         * The first hook added is the outermost. All around-hooks run after
         * the before-hooks, and their result is passed through the
         * after-hooks.
         * 
         * @param hook to add
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException if {@code hook} is {@code null}
         */
        Builder around(AroundHook hook);
        
        /**
         * Adds a hook that transforms the result.<p>
         * 
         * Hooks run in the order they were added.
         * 
         * @param hook to add
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException if {@code hook} is {@code null}
         */
        Builder after(AfterHook hook);
        
        /**
         * Builds a page that returns the given value.
         * 
         * @implSpec
         * The default implementation is equivalent to:
         * <pre>
         *   Objects.requireNonNull(value);
         *   return apply(args -{@literal >} CompletableFuture.completedStage(value));
         * </pre>
         * 
         * @param value to return
         * 
         * @return a new page
         * 
         * @throws NullPointerException if {@code value} is {@code null}
         */
        default Page respond(Object value) {
            requireNonNull(value);
            return apply(args -> completedStage(value));
        }
        
        /**
         * Builds a page that synchronously computes its result.
         * 
         * @implSpec
         * The default implementation is equivalent to:
         * <pre>
         *   Objects.requireNonNull(logic);
         *   return apply(args -{@literal >} CompletableFuture.completedStage(logic.apply(args)));
         * </pre>
         * 
         * @param logic to call
         * 
         * @return a new page
         * 
         * @throws NullPointerException if {@code logic} is {@code null}
         */
        default Page supply(Function<? super Arguments, ?> logic) {
            requireNonNull(logic);
            return apply(args -> completedStage(logic.apply(args)));
        }
        
        /**
         * Builds a page that asynchronously computes its result.
         * 
         * @param logic to call
         * 
         * @return a new page
         * 
         * @throws NullPointerException if {@code logic} is {@code null}
         */
        Page apply(Function<? super Arguments, ? extends CompletionStage<?>> logic);
    }
}
