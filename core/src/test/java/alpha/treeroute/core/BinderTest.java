package alpha.treeroute.core;

import alpha.treeroute.message.NamedValues;
import alpha.treeroute.message.Request;
import alpha.treeroute.resource.Page;
import alpha.treeroute.resource.Parameter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static alpha.treeroute.core.Binder.Mode.PARTIAL;
import static alpha.treeroute.core.Binder.Mode.STRICT;
import static alpha.treeroute.resource.Parameter.keywordOnly;
import static alpha.treeroute.resource.Parameter.positional;
import static alpha.treeroute.resource.Parameter.varKeyword;
import static alpha.treeroute.resource.Parameter.varPositional;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Binder}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class BinderTest
{
    @Test
    void positional_fromSegment() {
        var b = bind(page(positional("name")), List.of("John"), "");
        assertThat(b.args().get("name")).isEqualTo("John");
        assertThat(b.consumed()).isOne();
    }
    
    @Test
    void positional_fromNamed() {
        var b = bind(page(positional("name")), List.of(), "name=John");
        assertThat(b.args().get("name")).isEqualTo("John");
        assertThat(b.consumed()).isZero();
    }
    
    @Test
    void positional_both() {
        assertThatThrownBy(() -> bind(page(positional("id")), List.of("10"), "id=10"))
                .isExactlyInstanceOf(BindingException.class)
                .hasMessage("Parameter \"id\" has a positional value and a named value.");
    }
    
    @Test
    void positional_none() {
        assertThatThrownBy(() -> bind(page(positional("name")), List.of(), ""))
                .isExactlyInstanceOf(BindingException.class)
                .hasMessage("No value for parameter \"name\".");
    }
    
    @Test
    void positional_default() {
        var b = bind(page(positional("id", Integer::valueOf).withDefault(null)), List.of(), "");
        assertThat(b.args().asMap()).containsEntry("id", null);
    }
    
    @Test
    void keywordOnly_neverPositional() {
        var p = page(keywordOnly("q"));
        assertThatThrownBy(() -> bind(p, List.of("x"), "q=y"))
                .isExactlyInstanceOf(BindingException.class)
                .hasMessage("1 positional value(s) left over: [x]");
        assertThat(bind(p, List.of(), "q=y").args().get("q")).isEqualTo("y");
    }
    
    @Test
    void namedValues_lastWins() {
        var b = bind(page(keywordOnly("a")), List.of(), "a=1&a=2");
        assertThat(b.args().get("a")).isEqualTo("2");
    }
    
    @Test
    void namedValues_unclaimedIgnored() {
        var b = bind(page(keywordOnly("a")), List.of(), "a=1&zzz=2");
        assertThat(b.args().asMap()).containsOnlyKeys("a");
    }
    
    @Test
    void varPositional_takesRest() {
        var p = page(positional("first"), varPositional("rest", Integer::valueOf));
        var b = bind(p, List.of("a", "1", "2"), "");
        assertThat(b.args().get("first")).isEqualTo("a");
        assertThat(b.args().get("rest")).isEqualTo(List.of(1, 2));
        assertThat(b.consumed()).isEqualTo(3);
    }
    
    @Test
    void varPositional_empty() {
        var b = bind(page(varPositional("rest")), List.of(), "");
        assertThat(b.args().get("rest")).isEqualTo(List.of());
    }
    
    @Test
    void varKeyword_takesUnclaimed() {
        var p = page(keywordOnly("k"), varKeyword("kw"), keywordOnly("z").withDefault("d"));
        var b = bind(p, List.of(), "k=1&b=2&c=3&z=4");
        assertThat(b.args().get("k")).isEqualTo("1");
        assertThat(b.args().get("z")).isEqualTo("4");
        assertThat(b.args().<Map<String, String>>getAny("kw"))
                .containsExactly(Map.entry("b", "2"), Map.entry("c", "3"));
        // Declaration order
        assertThat(b.args().asMap().keySet()).containsExactly("k", "kw", "z");
    }
    
    @Test
    void partial_leavesRest() {
        var loc = page(positional("id"));
        var b = Binder.bind(loc, List.of("1", "topic", "2"), Request.parse("/"), PARTIAL);
        assertThat(b.consumed()).isOne();
        assertThat(b.args().get("id")).isEqualTo("1");
    }
    
    @Test
    void strict_leftOver() {
        assertThatThrownBy(() -> bind(page(positional("a")), List.of("1", "2", "3"), ""))
                .isExactlyInstanceOf(BindingException.class)
                .hasMessage("2 positional value(s) left over: [2, 3]");
    }
    
    @Test
    void converter_rejects() {
        var p = page(positional("id", Integer::valueOf));
        assertThatThrownBy(() -> bind(p, List.of("abc"), ""))
                .isExactlyInstanceOf(BindingException.class)
                .hasMessage("Parameter \"id\" rejected value \"abc\".")
                .hasCauseExactlyInstanceOf(NumberFormatException.class);
        // Same for a named value
        assertThatThrownBy(() -> bind(p, List.of(), "id=abc"))
                .isExactlyInstanceOf(BindingException.class);
    }
    
    @Test
    void converter_crashes() {
        var p = page(positional("id", raw -> { throw new IllegalStateException("bug"); }));
        assertThatThrownBy(() -> bind(p, List.of("1"), ""))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("bug");
    }
    
    @Test
    void arguments_undeclared() {
        var b = bind(page(positional("a")), List.of("1"), "");
        assertThatThrownBy(() -> b.args().get("b"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("No parameter named \"b\".");
    }
    
    @Test
    void arguments_request() {
        var req = Request.builder().segments(List.of("x")).body(NamedValues.of("a", "1")).build();
        var b = Binder.bind(page(keywordOnly("a")), List.of(), req, STRICT);
        assertThat(b.args().request()).isSameAs(req);
        assertThat(b.args().get("a")).isEqualTo("1");
    }
    
    private static Page page(Parameter... params) {
        return Page.builder().params(params).respond("x");
    }
    
    private static Binder.Bound bind(Page p, List<String> positional, String query) {
        var req = Request.parse(query.isEmpty() ? "/" : "/?" + query);
        return Binder.bind(p, positional, req, STRICT);
    }
}
