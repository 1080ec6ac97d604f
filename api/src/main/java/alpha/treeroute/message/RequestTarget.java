package alpha.treeroute.message;

import alpha.treeroute.util.PercentDecoder;

import java.util.ArrayList;
import java.util.List;

/**
 * The path and query of a raw request target.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestTarget
{
    /**
     * Parses the given input.<p>
     * 
     * The path is normalized:
     * 
     * <ul>
     *   <li>Clustered forward slashes are reduced to just one.</li>
     *   <li>Leading and trailing forward slashes are dropped.</li>
     *   <li>Dot-segments (".", "..") are normalized.</li>
     *   <li>Each remaining segment is percent-decoded.</li>
     * </ul>
     * 
     * The fragment, if present, is discarded.<p>
     * 
     * See sections "3.3 Path", "3.4 Query" and "3.5 Fragment" respectively in
     * <a href="https://tools.ietf.org/html/rfc3986#section-3.3">RFC 3986</a>.
     * 
     * @param rt raw request target, e.g. "/forum/12?offset=20"
     * 
     * @return the parsed target
     * 
     * @throws NullPointerException
     *             if {@code rt} is {@code null}
     * @throws IllegalArgumentException
     *             if a segment or query component has a malformed escape
     */
    static RequestTarget parse(String rt) {
        final int skip = rt.startsWith("/") ? 1 : 0;
        
        // Anything after '#' is the fragment, even a '?'
        final int f = rt.indexOf('#');
        final String target = f == -1 ? rt : rt.substring(0, f);
        final int q = target.indexOf('?', skip);
        
        final String path  = q == -1 ? target.substring(skip) : target.substring(skip, q),
                     query = q == -1 ? "" : target.substring(q + 1);
        
        // split() yields empty tokens for clustered slashes ("a//b") and a
        // single empty token for the empty path; both are dropped
        List<String> keep = new ArrayList<>();
        for (String t : path.split("/")) {
            if (t.isEmpty() || t.equals(".")) {
                continue;
            }
            // ".." removes the previous one if and only if previous is not ".."
            if (t.equals("..") &&
                    !keep.isEmpty() &&
                    !keep.get(keep.size() - 1).equals(".."))
            {
                keep.remove(keep.size() - 1);
            } else {
                keep.add(t);
            }
        }
        
        return new RequestTarget(PercentDecoder.decode(keep), NamedValues.parse(query));
    }
    
    private final List<String> segments;
    private final NamedValues query;
    
    private RequestTarget(List<String> segments, NamedValues query) {
        this.segments = segments;
        this.query = query;
    }
    
    /**
     * Returns normalized and percent-decoded path segments.
     * 
     * @return normalized and percent-decoded path segments (unmodifiable)
     */
    List<String> segments() {
        return segments;
    }
    
    /**
     * Returns the parsed query.
     * 
     * @return the parsed query
     */
    NamedValues query() {
        return query;
    }
}
