package alpha.treeroute.resource;

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * A member of a resource that yields another resource, into which the
 * resolution descends.<p>
 * 
 * Unlike a page, a locator does not need to absorb all positional values.
 * Its positional parameters take what they need, and the resolution continues
 * with the remaining segments against the returned resource. For example,
 * given the path "/forum/12/topic/10":
 * 
 * <pre>{@code
 *   Members.builder()
 *       .locator("forum", Locator.builder()
 *           .param(Parameter.positional("id", Integer::valueOf))
 *           .supply(args -> new Forum(args.getAny("id"))))
 *       .build();
 * }</pre>
 * 
 * The locator named "forum" receives "12" as its id and returns
 * {@code Forum(12)}, and the resolution continues with "topic/10".<p>
 * 
 * A locator may also be put in the {@code default} slot, in which case its
 * first positional value is the segment that matched no member.<p>
 * 
 * If the body completes with {@code null}, the request resolves to
 * {@code NotFoundException}. A value short-circuited by a {@link BeforeHook}
 * ends the resolution and becomes the result, even if it is a {@code Resource}
 * and even if segments remain. The invocation itself completes with the value
 * wrapped in a {@link ShortCircuit}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Locator extends Invocable
{
    /**
     * Returns a new builder of a locator.
     * 
     * @return a new builder of a locator
     */
    static Builder builder() {
        return new DefaultLocator.Builder();
    }
    
    /**
     * Builder of a {@link Locator}.<p>
     * 
     * The builder is not thread-safe and is intended to be used as a
     * throw-away object.
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
         *             see {@link Page.Builder#param(Parameter)}
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
         *             see {@link Page.Builder#param(Parameter)}
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
         * A value produced by the hook is wrapped in a {@link ShortCircuit}
         * and ends the resolution.
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
         * The first hook added is the outermost. A {@code Resource} produced
         * by the hook is descended into, just like one produced by the body.
         * 
         * @param hook to add
         * 
         * @return this (for chaining/fluency)
         * 
         * @throws NullPointerException if {@code hook} is {@code null}
         */
        Builder around(AroundHook hook);
        
        /**
         * Builds a locator that synchronously yields the next resource.
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
         * @return a new locator
         * 
         * @throws NullPointerException if {@code logic} is {@code null}
         */
        default Locator supply(Function<? super Arguments, ? extends Resource> logic) {
            requireNonNull(logic);
            return apply(args -> completedStage(logic.apply(args)));
        }
        
        /**
         * Builds a locator that asynchronously yields the next resource.
         * 
         * @param logic to call
         * 
         * @return a new locator
         * 
         * @throws NullPointerException if {@code logic} is {@code null}
         */
        Locator apply(Function<? super Arguments, ? extends CompletionStage<? extends Resource>> logic);
    }
}
