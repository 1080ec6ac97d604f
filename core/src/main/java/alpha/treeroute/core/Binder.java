package alpha.treeroute.core;

import alpha.treeroute.message.NamedValues;
import alpha.treeroute.message.Request;
import alpha.treeroute.resource.Invocable;
import alpha.treeroute.resource.Parameter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.text.MessageFormat.format;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * Binds positional and named values to the parameters of a page or locator.<p>
 * 
 * Parameters are processed in declaration order:
 * 
 * <ul>
 *   <li>{@code POSITIONAL} takes the next positional value, else the named
 *       value of the same name, else the default. It is a failure if both a
 *       positional value and a named value are available.</li>
 *   <li>{@code VAR_POSITIONAL} takes all remaining positional values.</li>
 *   <li>{@code KEYWORD_ONLY} takes the named value, else the default.</li>
 *   <li>{@code VAR_KEYWORD} takes all named values not claimed by name by
 *       another parameter.</li>
 * </ul>
 * 
 * Named values that no parameter asked for are ignored. In {@link
 * Mode#STRICT strict} mode, positional values that no parameter took are a
 * failure.<p>
 * 
 * Raw values are passed through the parameter's converter. A converter
 * throwing {@code IllegalArgumentException} is a failure, any other exception
 * propagates.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Binder
{
    private Binder() {
        // Empty
    }
    
    /**
     * What to do with positional values no parameter took.
     */
    enum Mode {
        /** Fail; used for pages. */
        STRICT,
        /** Leave them for the next resource; used for locators. */
        PARTIAL
    }
    
    /**
     * The outcome of a successful binding.
     * 
     * @param args bound arguments
     * @param consumed number of positional values taken
     */
    record Bound(DefaultArguments args, int consumed) {
        // Empty
    }
    
    /**
     * Binds values to the parameters of the given target.
     * 
     * @param target of binding
     * @param positional values
     * @param request supplying named values
     * @param mode of binding
     * 
     * @return the outcome
     * 
     * @throws BindingException
     *             if the values do not satisfy the parameters
     * @throws RuntimeException
     *             anything else thrown by a converter
     */
    static Bound bind(Invocable target, List<String> positional, Request request, Mode mode) {
        final NamedValues bag = request.namedValues();
        final var values = new LinkedHashMap<String, Object>();
        final Set<String> claimed = new HashSet<>();
        Parameter varKeyword = null;
        int next = 0;
        
        for (Parameter p : target.parameters()) {
            final String n = p.name();
            switch (p.kind()) {
                case POSITIONAL:
                    claimed.add(n);
                    if (next < positional.size()) {
                        if (bag.contains(n)) {
                            throw new BindingException(format(
                                "Parameter \"{0}\" has a positional value and a named value.", n));
                        }
                        values.put(n, convert(p, positional.get(next++)));
                    } else {
                        values.put(n, named(p, bag));
                    }
                    break;
                case KEYWORD_ONLY:
                    claimed.add(n);
                    values.put(n, named(p, bag));
                    break;
                case VAR_POSITIONAL:
                    List<Object> rest = new ArrayList<>();
                    while (next < positional.size()) {
                        rest.add(convert(p, positional.get(next++)));
                    }
                    values.put(n, unmodifiableList(rest));
                    break;
                case VAR_KEYWORD:
                    // Placeholder, keeps declaration order
                    values.put(n, null);
                    varKeyword = p;
                    break;
                default:
                    throw new AssertionError("Unexpected: " + p.kind());
            }
        }
        
        if (varKeyword != null) {
            Map<String, String> unclaimed = new LinkedHashMap<>();
            bag.asMap().forEach((k, v) -> {
                if (!claimed.contains(k)) {
                    unclaimed.put(k, v);
                }
            });
            values.put(varKeyword.name(), unmodifiableMap(unclaimed));
        }
        
        if (mode == Mode.STRICT && next < positional.size()) {
            final int n = positional.size() - next;
            throw new BindingException(format(
                "{0} positional value(s) left over: {1}",
                n, positional.subList(next, positional.size())));
        }
        
        return new Bound(new DefaultArguments(values, request), next);
    }
    
    private static Object named(Parameter p, NamedValues bag) {
        var raw = bag.get(p.name());
        if (raw.isPresent()) {
            return convert(p, raw.get());
        }
        if (p.hasDefault()) {
            return p.defaultValue();
        }
        throw new BindingException(format(
                "No value for parameter \"{0}\".", p.name()));
    }
    
    private static Object convert(Parameter p, String raw) {
        try {
            return p.converter().convert(raw);
        } catch (IllegalArgumentException e) {
            throw new BindingException(format(
                "Parameter \"{0}\" rejected value \"{1}\".", p.name(), raw), e);
        }
    }
}
