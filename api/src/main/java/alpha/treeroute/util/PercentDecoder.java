package alpha.treeroute.util;

import java.net.URLDecoder;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableList;

/**
 * Percent-decoding of path segments.<p>
 * 
 * Unlike {@link URLDecoder}, a plus character is not translated into a space.
 * A plus is a legal character of a path segment, and the application is
 * expected to send a space as "%20". Query strings and form bodies use the
 * form encoding where a plus is a space, see {@code NamedValues.parse}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class PercentDecoder
{
    private PercentDecoder() {
        // Empty
    }
    
    /**
     * Percent-decodes the given string using UTF-8.
     * 
     * @param str to decode
     * 
     * @return the decoded string
     * 
     * @throws NullPointerException if {@code str} is {@code null}
     * @throws IllegalArgumentException if {@code str} has a malformed escape
     */
    public static String decode(String str) {
        if (str.indexOf('+') == -1) {
            return URLDecoder.decode(str, UTF_8);
        }
        // Decode the chunks surrounding each plus and keep the plus as is
        var joiner = new StringJoiner("+");
        for (String chunk : str.split("\\+", -1)) {
            joiner.add(URLDecoder.decode(chunk, UTF_8));
        }
        return joiner.toString();
    }
    
    /**
     * Percent-decodes all given strings.<p>
     * 
     * The returned list is unmodifiable.
     * 
     * @param strings to decode
     * 
     * @return the decoded strings, in iteration order
     * 
     * @throws NullPointerException if {@code strings} or an element is {@code null}
     * @throws IllegalArgumentException if a string has a malformed escape
     */
    public static List<String> decode(Iterable<String> strings) {
        List<String> l = new ArrayList<>();
        strings.forEach(s -> l.add(decode(s)));
        return unmodifiableList(l);
    }
}
