package alpha.treeroute.core;

import alpha.treeroute.resource.Invocable;
import alpha.treeroute.resource.Locator;
import alpha.treeroute.resource.Members;
import alpha.treeroute.resource.Page;
import alpha.treeroute.resource.Resource;

import java.util.List;
import java.util.Optional;

/**
 * Selects the member of a resource that the next path segment refers to.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Selector
{
    private Selector() {
        // Empty
    }
    
    /**
     * What was selected.
     */
    enum Kind {
        /** A named page. */
        PAGE,
        /** A named child resource. */
        CHILD,
        /** A named locator. */
        LOCATOR,
        /** The index page; no segment remains. */
        INDEX,
        /** The default page; the segment matched no member. */
        DEFAULT_PAGE,
        /** The default locator; the segment matched no member. */
        DEFAULT_LOCATOR
    }
    
    /**
     * A selected member.<p>
     * 
     * The positional values of an invocable member are the segments from
     * {@code offset} (inclusive) to the end. For a named member, the offset
     * is the position after its name. For a default member, the offset is the
     * position of the unmatched segment. The index receives no positional
     * values.
     * 
     * @param kind of member
     * @param member a {@code Resource} or an {@code Invocable}
     * @param offset of first positional value
     */
    record Selection(Kind kind, Object member, int offset) {
        Resource child() {
            return (Resource) member;
        }
        
        Invocable invocable() {
            return (Invocable) member;
        }
        
        boolean locates() {
            return kind == Kind.LOCATOR || kind == Kind.DEFAULT_LOCATOR;
        }
        
        List<String> positional(List<String> segments) {
            return kind == Kind.INDEX ? List.of() :
                    segments.subList(offset, segments.size());
        }
    }
    
    /**
     * Selects a member.<p>
     * 
     * A segment is matched against named pages, child resources and
     * locators, in that order, although a name can only be taken by one of
     * them. If no member matches, the default slot is selected. If no segment
     * remains, the index slot is selected.
     * 
     * @param members of resource
     * @param segments of request
     * @param pos position of next segment
     * 
     * @return the selection, or empty if nothing could be selected
     */
    static Optional<Selection> select(Members members, List<String> segments, int pos) {
        if (pos == segments.size()) {
            return members.index().map(p -> new Selection(Kind.INDEX, p, pos));
        }
        
        final String seg = segments.get(pos);
        
        Optional<Page> page = members.page(seg);
        if (page.isPresent()) {
            return Optional.of(new Selection(Kind.PAGE, page.get(), pos + 1));
        }
        Optional<Resource> child = members.child(seg);
        if (child.isPresent()) {
            return Optional.of(new Selection(Kind.CHILD, child.get(), pos + 1));
        }
        Optional<Locator> loc = members.locator(seg);
        if (loc.isPresent()) {
            return Optional.of(new Selection(Kind.LOCATOR, loc.get(), pos + 1));
        }
        
        return members.fallback().map(inv -> new Selection(
                inv instanceof Locator ? Kind.DEFAULT_LOCATOR : Kind.DEFAULT_PAGE,
                inv, pos));
    }
}
