package alpha.treeroute.message;

import java.net.URLDecoder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * An immutable bag of named string values, typically sourced from a query
 * string and a form body.<p>
 * 
 * A name may occur many times. {@link #get(String)} returns the last
 * occurrence, {@link #all(String)} returns all of them in order. So, given
 * the query string "?a=1&amp;a=2", {@code get("a")} returns "2".<p>
 * 
 * Names are iterated in the order they were first seen.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class NamedValues
{
    private static final NamedValues EMPTY = new NamedValues(Map.of());
    
    /**
     * Returns an empty bag.
     * 
     * @return an empty bag
     */
    public static NamedValues empty() {
        return EMPTY;
    }
    
    /**
     * Creates a bag from alternating names and values.<p>
     * 
     * <pre>{@code
     *   NamedValues nv = NamedValues.of("offset", "20", "num", "20");
     * }</pre>
     * 
     * @param nameValuePairs names and values
     * 
     * @return a new bag
     * 
     * @throws NullPointerException
     *             if {@code nameValuePairs} or an element is {@code null}
     * @throws IllegalArgumentException
     *             if {@code nameValuePairs} has an odd length
     */
    public static NamedValues of(String... nameValuePairs) {
        if (nameValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Odd number of arguments: " + nameValuePairs.length);
        }
        var m = new LinkedHashMap<String, List<String>>();
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            add(m, requireNonNull(nameValuePairs[i]),
                   requireNonNull(nameValuePairs[i + 1]));
        }
        return seal(m);
    }
    
    /**
     * Parses a query string, or a form body of media type
     * "application/x-www-form-urlencoded".<p>
     * 
     * Pairs are separated by '&amp;' and the name is separated from the value
     * by the first '='. A pair without '=' has the empty string as value.
     * Names and values are decoded the way {@link URLDecoder} does it, i.e.
     * percent-escapes are decoded using UTF-8 and a '+' is a space. A leading
     * '?' is not expected, and would be a part of the first name.
     * 
     * @param query to parse (not percent-decoded)
     * 
     * @return a new bag
     * 
     * @throws NullPointerException
     *             if {@code query} is {@code null}
     * @throws IllegalArgumentException
     *             if a name or value has a malformed percent-escape
     */
    public static NamedValues parse(String query) {
        if (query.isEmpty()) {
            return EMPTY;
        }
        var m = new LinkedHashMap<String, List<String>>();
        for (String p : query.split("&")) {
            if (p.isEmpty()) {
                continue;
            }
            int i = p.indexOf('=');
            // Value may be the empty string
            String k = p.substring(0, i == -1 ? p.length() : i),
                   v = i == -1 ? "" : p.substring(i + 1);
            add(m, URLDecoder.decode(k, UTF_8), URLDecoder.decode(v, UTF_8));
        }
        return m.isEmpty() ? EMPTY : seal(m);
    }
    
    private static void add(Map<String, List<String>> m, String name, String value) {
        m.computeIfAbsent(name, k -> new ArrayList<>(1)).add(value);
    }
    
    private static NamedValues seal(LinkedHashMap<String, List<String>> m) {
        m.entrySet().forEach(e -> e.setValue(unmodifiableList(e.getValue())));
        return new NamedValues(unmodifiableMap(m));
    }
    
    private final Map<String, List<String>> values;
    
    private NamedValues(Map<String, List<String>> values) {
        this.values = values;
    }
    
    /**
     * Returns the last value of the given name.
     * 
     * @param name of value
     * 
     * @return the last value of the given name (never {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public Optional<String> get(String name) {
        var l = all(name);
        return l.isEmpty() ? Optional.empty() : Optional.of(l.get(l.size() - 1));
    }
    
    /**
     * Returns all values of the given name.
     * 
     * @param name of values
     * 
     * @return all values of the given name (unmodifiable, possibly empty)
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public List<String> all(String name) {
        requireNonNull(name);
        return values.getOrDefault(name, List.of());
    }
    
    /**
     * Returns {@code true} if at least one value has the given name.
     * 
     * @param name of value
     * 
     * @return {@code true} if at least one value has the given name
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public boolean contains(String name) {
        requireNonNull(name);
        return values.containsKey(name);
    }
    
    /**
     * Returns all names.
     * 
     * @return all names (unmodifiable)
     */
    public Set<String> names() {
        return values.keySet();
    }
    
    /**
     * Returns {@code true} if there are no values.
     * 
     * @return {@code true} if there are no values
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }
    
    /**
     * Returns a map of each name to its last value.
     * 
     * @return a map of each name to its last value (unmodifiable)
     */
    public Map<String, String> asMap() {
        var m = new LinkedHashMap<String, String>();
        values.forEach((k, v) -> m.put(k, v.get(v.size() - 1)));
        return Collections.unmodifiableMap(m);
    }
    
    /**
     * Returns a bag with the values of this bag followed by the values of the
     * given bag.<p>
     * 
     * For a name present in both bags, the given bag's values are placed last
     * and therefore win a {@link #get(String)}.
     * 
     * @param other bag
     * 
     * @return a new bag, or one of the operands if the other is empty
     * 
     * @throws NullPointerException if {@code other} is {@code null}
     */
    public NamedValues append(NamedValues other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var m = new LinkedHashMap<String, List<String>>();
        values.forEach((k, v) -> m.put(k, new ArrayList<>(v)));
        other.values.forEach((k, v) -> m.computeIfAbsent(k, x -> new ArrayList<>(v.size())).addAll(v));
        return seal(m);
    }
    
    @Override
    public boolean equals(Object obj) {
        return obj instanceof NamedValues other && values.equals(other.values);
    }
    
    @Override
    public int hashCode() {
        return values.hashCode();
    }
    
    @Override
    public String toString() {
        return values.toString();
    }
}
