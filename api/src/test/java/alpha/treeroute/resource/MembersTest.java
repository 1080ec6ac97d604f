package alpha.treeroute.resource;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static alpha.treeroute.resource.Parameter.keywordOnly;
import static alpha.treeroute.resource.Parameter.positional;
import static alpha.treeroute.resource.Parameter.varPositional;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Members}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class MembersTest
{
    private static final Page     PAGE    = Page.builder().respond("page");
    private static final Resource CHILD   = Resources.of(Members.builder().build());
    private static final Locator  LOCATOR = Locator.builder().supply(args -> CHILD);
    
    @Test
    void lookup() {
        var m = Members.builder()
                .page("p", PAGE)
                .child("c", CHILD)
                .locator("l", LOCATOR)
                .build();
        assertThat(m.page("p")).containsSame(PAGE);
        assertThat(m.child("c")).containsSame(CHILD);
        assertThat(m.locator("l")).containsSame(LOCATOR);
        // Each lookup only finds its own kind
        assertThat(m.page("c")).isEmpty();
        assertThat(m.child("l")).isEmpty();
        assertThat(m.locator("p")).isEmpty();
        assertThat(m.names()).containsExactly("p", "c", "l");
        assertThat(m.index()).isEmpty();
        assertThat(m.fallback()).isEmpty();
    }
    
    @Test
    void caseSensitive() {
        var m = Members.builder().page("About", PAGE).build();
        assertThat(m.page("about")).isEmpty();
    }
    
    @Test
    void collision_acrossKinds() {
        var b = Members.builder().page("x", PAGE);
        assertThatThrownBy(() -> b.child("x", CHILD))
                .isExactlyInstanceOf(MemberCollisionException.class)
                .hasMessage("Member \"x\" is already registered.");
        assertThatThrownBy(() -> b.locator("x", LOCATOR))
                .isExactlyInstanceOf(MemberCollisionException.class);
        assertThatThrownBy(() -> b.page("x", PAGE))
                .isExactlyInstanceOf(MemberCollisionException.class);
    }
    
    @Test
    void collision_index() {
        var b = Members.builder().index(PAGE);
        assertThatThrownBy(() -> b.page("index", PAGE))
                .isExactlyInstanceOf(MemberCollisionException.class)
                .hasMessage("Slot \"index\" is already taken.");
    }
    
    @Test
    void collision_default() {
        var b = Members.builder().fallback(Page.builder()
                .param(positional("seg"))
                .respond("x"));
        assertThatThrownBy(() -> b.locator("default", Locator.builder()
                        .param(positional("seg"))
                        .supply(args -> CHILD)))
                .isExactlyInstanceOf(MemberCollisionException.class)
                .hasMessage("Slot \"default\" is already taken.");
    }
    
    @Test
    void slotNames_fillSlots() {
        var fallback = Page.builder().param(varPositional("all")).respond("x");
        var m = Members.builder()
                .page("index", PAGE)
                .page("default", fallback)
                .build();
        assertThat(m.index()).containsSame(PAGE);
        assertThat(m.fallback()).containsSame(fallback);
        // Slots are not named members
        assertThat(m.names()).isEmpty();
        assertThat(m.page("index")).isEmpty();
    }
    
    @Test
    void defaultLocator() {
        var loc = Locator.builder().param(positional("id")).supply(args -> CHILD);
        var m = Members.builder().locator("default", loc).build();
        assertThat(m.fallback()).containsSame(loc);
    }
    
    @Test
    void index_asChild() {
        assertThatThrownBy(() -> Members.builder().child("index", CHILD))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Slot \"index\" can not hold a child resource.");
    }
    
    @Test
    void default_asChild() {
        assertThatThrownBy(() -> Members.builder().child("default", CHILD))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Slot \"default\" can not hold a child resource.");
    }
    
    @Test
    void index_asLocator() {
        assertThatThrownBy(() -> Members.builder().locator("index", LOCATOR))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Slot \"index\" can only hold a page.");
    }
    
    @Test
    void index_withVarPositional() {
        var page = Page.builder().param(varPositional("rest")).respond("x");
        assertThatThrownBy(() -> Members.builder().index(page))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Slot \"index\" never receives positional values, can not declare VAR_POSITIONAL \"rest\".");
    }
    
    @Test
    void index_withPositional_isOkay() {
        // Can still be bound by name
        var page = Page.builder().param(positional("id")).respond("x");
        assertThat(Members.builder().index(page).build().index()).containsSame(page);
    }
    
    @Test
    void default_withoutPositional() {
        var page = Page.builder().param(keywordOnly("q")).respond("x");
        assertThatThrownBy(() -> Members.builder().fallback(page))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Slot \"default\" must declare a positional parameter for the unmatched segment.");
        assertThatThrownBy(() -> Members.builder().fallback(LOCATOR))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    void name_blank() {
        assertThatThrownBy(() -> Members.builder().page(" ", PAGE))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Member name is blank.");
    }
    
    @Test
    void name_slash() {
        assertThatThrownBy(() -> Members.builder().child("a/b", CHILD))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Member name contains a forward slash: \"a/b\".");
    }
    
    @Test
    void nulls() {
        var b = Members.builder();
        assertThatThrownBy(() -> b.page(null, PAGE))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> b.page("p", null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
    
    @Test
    void build_isSnapshot() {
        var b = Members.builder().page("a", PAGE);
        var m = b.build();
        b.page("b", PAGE);
        assertThat(m.names()).containsExactly("a");
    }
    
    @Test
    void mapping() {
        var r = Resources.mapping(Map.of("c", CHILD));
        assertThat(r.members().child("c")).containsSame(CHILD);
    }
}
