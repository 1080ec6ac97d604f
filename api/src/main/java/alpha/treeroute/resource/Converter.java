package alpha.treeroute.resource;

import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Converts a raw string value into the type a parameter declares.<p>
 * 
 * A converter rejects invalid input by throwing an {@link
 * IllegalArgumentException}, which the binder translates into a failed
 * binding, and the request will resolve to a {@code NotFoundException}. Since
 * {@link NumberFormatException} is an {@code IllegalArgumentException}, many
 * JDK factories are converters as-is:
 * 
 * <pre>{@code
 *   Parameter id  = Parameter.positional("id", Integer::valueOf);
 *   Parameter on = Parameter.keywordOnly("on", Boolean::valueOf);
 * }</pre>
 * 
 * Any other exception thrown by a converter is considered an application
 * error and propagates to the caller of the resolution unchanged.
 * 
 * @param <T> type of converted value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Converter<T>
{
    /**
     * Returns a converter that returns the raw value.
     * 
     * @return a converter that returns the raw value
     */
    static Converter<String> identity() {
        return raw -> raw;
    }
    
    /**
     * Converts the given raw value.
     * 
     * @param raw value (never {@code null})
     * 
     * @return the converted value
     * 
     * @throws IllegalArgumentException if the raw value is invalid
     */
    T convert(String raw);
    
    /**
     * Returns a converter that also validates the converted value.<p>
     * 
     * <pre>{@code
     *   Converter<Integer> positive = Integer::valueOf;
     *   Parameter page = Parameter.keywordOnly("page", positive.validate(i -> i > 0));
     * }</pre>
     * 
     * @param check of converted value
     * 
     * @return a converter that throws {@code IllegalArgumentException} if the
     *         check fails
     * 
     * @throws NullPointerException if {@code check} is {@code null}
     */
    default Converter<T> validate(Predicate<? super T> check) {
        requireNonNull(check);
        return raw -> {
            T val = convert(raw);
            if (!check.test(val)) {
                throw new IllegalArgumentException("Invalid value: \"" + raw + "\"");
            }
            return val;
        };
    }
}
