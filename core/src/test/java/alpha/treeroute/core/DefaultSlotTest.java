package alpha.treeroute.core;

import alpha.treeroute.Config;
import alpha.treeroute.Site;
import alpha.treeroute.resource.Members;
import alpha.treeroute.resource.Page;
import alpha.treeroute.resource.Resource;
import alpha.treeroute.resource.Resources;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static alpha.treeroute.resource.Parameter.keywordOnly;
import static alpha.treeroute.resource.Parameter.positional;
import static alpha.treeroute.resource.Parameter.varKeyword;
import static alpha.treeroute.resource.Parameter.varPositional;
import static alpha.treeroute.testutil.Assertions.assertNotFound;
import static alpha.treeroute.testutil.Assertions.assertResult;

/**
 * Resolves paths through default pages and variadic parameters.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultSlotTest
{
    private static final Resource ONE = Resources.of(Members.builder()
            .index(Page.builder().respond("one_index"))
            .fallback(Page.builder()
                .param(positional("one"))
                .supply(a -> "one:" + a.get("one")))
            .build());
    
    private static final Resource STAR = Resources.of(Members.builder()
            .fallback(Page.builder()
                .param(varPositional("star"))
                .supply(a -> "star:" + String.join(":", a.<List<String>>getAny("star"))))
            .build());
    
    private static final Resource ONE_STAR = Resources.of(Members.builder()
            .fallback(Page.builder()
                .param(positional("one"))
                .param(varPositional("star"))
                .supply(a -> "onestar(" + a.get("one") + "):" +
                        String.join(":", a.<List<String>>getAny("star"))))
            .build());
    
    private static final Resource KW = Resources.of(Members.builder()
            .page("justkw", Page.builder()
                .param(varKeyword("kw"))
                .supply(a -> "justkw:" + a.get("kw")))
            .page("kwargkw", Page.builder()
                .param(keywordOnly("a"))
                .param(varKeyword("kw"))
                .supply(a -> "kwargkw:" + a.get("a") + ":" + a.get("kw")))
            .page("poskw", Page.builder()
                .param(positional("a"))
                .param(varKeyword("kw"))
                .supply(a -> "poskw:" + a.get("a") + ":" + a.get("kw")))
            .page("varposkw", Page.builder()
                .param(varPositional("a"))
                .param(varKeyword("kw"))
                .supply(a -> "varposkw:" +
                        String.join(",", a.<List<String>>getAny("a")) + ":" + a.get("kw")))
            .build());
    
    private final Site site = new DefaultSite(Config.DEFAULT,
            Resources.mapping(Map.of("one", ONE, "star", STAR, "onestar", ONE_STAR)),
            KW);
    
    @Test
    void default_takesSegment() throws InterruptedException, TimeoutException {
        assertResult(site.resolve("/one/arg")).isEqualTo("one:arg");
    }
    
    @Test
    void default_indexStillWins() throws InterruptedException, TimeoutException {
        assertResult(site.resolve("/one")).isEqualTo("one_index");
    }
    
    @Test
    void default_tooMany() throws InterruptedException, TimeoutException {
        assertNotFound(site.resolve("/one/arg/test"));
    }
    
    @Test
    void star_needsSegment() throws InterruptedException, TimeoutException {
        // No segment, so the default is not selected and there is no index
        assertNotFound(site.resolve("/star"));
    }
    
    @Test
    void star() throws InterruptedException, TimeoutException {
        assertResult(site.resolve("/star/a")).isEqualTo("star:a");
        assertResult(site.resolve("/star/a/b")).isEqualTo("star:a:b");
    }
    
    @Test
    void oneStar() throws InterruptedException, TimeoutException {
        assertNotFound(site.resolve("/onestar"));
        assertResult(site.resolve("/onestar/a")).isEqualTo("onestar(a):");
        assertResult(site.resolve("/onestar/a/b")).isEqualTo("onestar(a):b");
        assertResult(site.resolve("/onestar/a/b/c")).isEqualTo("onestar(a):b:c");
    }
    
    @Test
    void varKeyword_empty() throws InterruptedException, TimeoutException {
        assertResult(site.resolve("/justkw")).isEqualTo("justkw:{}");
    }
    
    @Test
    void varKeyword_all() throws InterruptedException, TimeoutException {
        assertResult(site.resolve("/justkw?a=1")).isEqualTo("justkw:{a=1}");
    }
    
    @Test
    void varKeyword_afterKeywordOnly() throws InterruptedException, TimeoutException {
        assertResult(site.resolve("/kwargkw?a=1&b=2")).isEqualTo("kwargkw:1:{b=2}");
    }
    
    @Test
    void varKeyword_afterPositional() throws InterruptedException, TimeoutException {
        assertResult(site.resolve("/poskw/a?b=2")).isEqualTo("poskw:a:{b=2}");
        assertResult(site.resolve("/poskw?a=1&b=2")).isEqualTo("poskw:1:{b=2}");
    }
    
    @Test
    void varKeyword_afterVarPositional() throws InterruptedException, TimeoutException {
        assertResult(site.resolve("/varposkw/a/b/c?b=2")).isEqualTo("varposkw:a,b,c:{b=2}");
    }
}
