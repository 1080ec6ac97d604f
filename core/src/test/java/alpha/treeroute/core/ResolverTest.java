package alpha.treeroute.core;

import alpha.treeroute.NotFoundException;
import alpha.treeroute.message.Request;
import alpha.treeroute.resource.Locator;
import alpha.treeroute.resource.Members;
import alpha.treeroute.resource.Page;
import alpha.treeroute.resource.Resource;
import alpha.treeroute.resource.Resources;
import alpha.treeroute.resource.ShortCircuit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.LinkedHashMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeoutException;

import static alpha.treeroute.resource.Parameter.keywordOnly;
import static alpha.treeroute.resource.Parameter.positional;
import static alpha.treeroute.resource.Parameter.varPositional;
import static alpha.treeroute.testutil.Assertions.assertFailure;
import static alpha.treeroute.testutil.Assertions.assertNotFound;
import static alpha.treeroute.testutil.Assertions.assertResult;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Small tests for {@link Resolver}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ResolverTest
{
    private static final Resource HELLO = Resources.of(Members.builder()
            .index(Page.builder().respond("Hello World!"))
            .page("hello", Page.builder()
                .param(positional("name"))
                .supply(a -> "Hello " + a.get("name") + "!"))
            .build());
    
    private static final Resource FORUM = Resources.of(Members.builder()
            .page("topic", Page.builder()
                .param(positional("topic", Integer::valueOf))
                .supply(a -> a.get("topic")))
            .build());
    
    @Test
    void positionalOrNamed_sameResult() throws InterruptedException, TimeoutException {
        assertResult(resolve(HELLO, "/hello/John")).isEqualTo("Hello John!");
        assertResult(resolve(HELLO, "/hello?name=John")).isEqualTo("Hello John!");
    }
    
    @Test
    void requiredMissing_notFound() throws InterruptedException, TimeoutException {
        assertNotFound(resolve(HELLO, "/hello")).hasMessage("/hello");
    }
    
    @Test
    void index() throws InterruptedException, TimeoutException {
        assertResult(resolve(HELLO, "/")).isEqualTo("Hello World!");
    }
    
    @Test
    void converted() throws InterruptedException, TimeoutException {
        assertResult(resolve(FORUM, "/topic/1234")).isEqualTo(1234);
        assertNotFound(resolve(FORUM, "/topic/abc"));
    }
    
    @Test
    void children() throws InterruptedException, TimeoutException {
        var root = Resources.mapping(Map.of(
                "forum", Resources.of(Members.builder().index(Page.builder().respond("topics")).build()),
                "news",  Resources.of(Members.builder().index(Page.builder().respond("all_news")).build())));
        assertNotFound(resolve(root, "/"));
        assertResult(resolve(root, "/forum")).isEqualTo("topics");
        assertResult(resolve(root, "/news")).isEqualTo("all_news");
    }
    
    @Test
    void locator_resumesAfterConsumed() throws InterruptedException, TimeoutException {
        var root = Resources.of(Members.builder()
                .locator("user", Locator.builder()
                    .param(positional("id"))
                    .supply(a -> Resources.of(Members.builder()
                        .index(Page.builder().respond("user " + a.get("id")))
                        .page("name", Page.builder().respond("name of " + a.get("id")))
                        .build())))
                .build());
        assertResult(resolve(root, "/user/7")).isEqualTo("user 7");
        assertResult(resolve(root, "/user/7/name")).isEqualTo("name of 7");
        assertResult(resolve(root, "/user/name?id=7")).isEqualTo("name of 7");
    }
    
    @Test
    void locator_null() throws InterruptedException, TimeoutException {
        var root = Resources.of(Members.builder()
                .locator("x", Locator.builder().supply(a -> null))
                .build());
        var ctx = ctx("/x");
        assertNotFound(Resolver.resolve(root, ctx));
        assertThat(ctx.trace()).containsExactly(
                "\"x\" selects LOCATOR",
                "Locator yielded null.");
    }
    
    @Test
    void locator_shortCircuit_endsResolution() throws InterruptedException, TimeoutException {
        var root = Resources.of(Members.builder()
                .locator("admin", Locator.builder()
                    .before(a -> completedStage(Optional.of("login first")))
                    .supply(a -> HELLO))
                .build());
        // Remaining segments are ignored
        assertResult(resolve(root, "/admin/hello/John")).isEqualTo("login first");
    }
    
    @Test
    void locator_shortCircuitWithResource_isResult() throws InterruptedException, TimeoutException {
        var cached = Resources.of(Members.builder()
                .index(Page.builder().respond("cached index"))
                .build());
        var root = Resources.of(Members.builder()
                .locator("f", Locator.builder()
                    .before(a -> completedStage(Optional.of(cached)))
                    .supply(a -> HELLO))
                .build());
        assertResult(resolve(root, "/f")).isSameAs(cached);
        assertResult(resolve(root, "/f/hello/John")).isSameAs(cached);
    }
    
    @Test
    void locator_around_replacesArgument() throws InterruptedException, TimeoutException {
        var root = Resources.of(Members.builder()
                .locator("forum", Locator.builder()
                    .param(positional("id", Integer::valueOf))
                    .around((a, proceed) -> proceed.apply(a.with("id", 1 + a.<Integer>getAny("id"))))
                    .supply(a -> Resources.of(Members.builder()
                        .index(Page.builder().respond("forum " + a.get("id")))
                        .build())))
                .build());
        assertResult(resolve(root, "/forum/12")).isEqualTo("forum 13");
    }
    
    @Test
    void page_around_skipsBody() throws InterruptedException, TimeoutException {
        var root = Resources.of(Members.builder()
                .page("form1", Page.builder()
                    .param(positional("a").withDefault(null))
                    .param(keywordOnly("b").withDefault(null))
                    .around((a, proceed) -> a.get("a") == null ?
                        completedStage("form") : proceed.apply(a))
                    .supply(a -> "form1(" + a.get("a") + ", " + a.get("b") + ")"))
                .build());
        assertResult(resolve(root, "/form1")).isEqualTo("form");
        assertResult(resolve(root, "/form1/1?b=2")).isEqualTo("form1(1, 2)");
    }
    
    @Test
    void defaultPage_takesUnmatched() throws InterruptedException, TimeoutException {
        var root = Resources.of(Members.builder()
                .page("a", Page.builder().respond("a"))
                .fallback(Page.builder()
                    .param(varPositional("rest"))
                    .supply(a -> a.get("rest")))
                .build());
        assertResult(resolve(root, "/a")).isEqualTo("a");
        assertResult(resolve(root, "/b/c")).isEqualTo(List.of("b", "c"));
        // Slot names are not members
        assertResult(resolve(root, "/default")).isEqualTo(List.of("default"));
    }
    
    @Test
    void defaultLocator() throws InterruptedException, TimeoutException {
        var root = Resources.of(Members.builder()
                .fallback(Locator.builder()
                    .param(positional("slug"))
                    .supply(a -> Resources.of(Members.builder()
                        .index(Page.builder().respond("post " + a.get("slug")))
                        .build())))
                .build());
        assertResult(resolve(root, "/my-post")).isEqualTo("post my-post");
        assertNotFound(resolve(root, "/"));
    }
    
    @Test
    void strict_excessive() throws InterruptedException, TimeoutException {
        var ctx = ctx("/hello/John/Doe");
        assertNotFound(Resolver.resolve(HELLO, ctx));
        assertThat(ctx.trace()).containsExactly(
                "\"hello\" selects PAGE",
                "1 positional value(s) left over: [Doe]");
    }
    
    @Test
    void noMember_trace() throws InterruptedException, TimeoutException {
        var ctx = ctx("/nope");
        assertNotFound(Resolver.resolve(HELLO, ctx));
        assertThat(ctx.trace()).containsExactly(
                "\"nope\" matched no member and there is no default.");
    }
    
    @Test
    void applicationError_propagates() throws InterruptedException, TimeoutException {
        var root = Resources.of(Members.builder()
                .page("boom", Page.builder().supply(a -> { throw new IllegalStateException("boom"); }))
                .page("async", Page.builder().apply(a ->
                    failedStage(new ArithmeticException())))
                .build());
        assertFailure(resolve(root, "/boom"))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
        assertFailure(resolve(root, "/async"))
                .isExactlyInstanceOf(ArithmeticException.class);
    }
    
    @Test
    void members_throws() throws InterruptedException, TimeoutException {
        Resource bad = () -> { throw new UnsupportedOperationException(); };
        assertFailure(resolve(bad, "/"))
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
    
    @Test
    void invoke_returnsNull() throws InterruptedException, TimeoutException {
        Page p = mock(Page.class);
        when(p.parameters()).thenReturn(List.of(keywordOnly("q").withDefault("")));
        var root = Resources.of(Members.builder().page("p", p).build());
        assertFailure(resolve(root, "/p"))
                .isExactlyInstanceOf(NullPointerException.class)
                .hasMessageStartingWith("Invocation returned null: ");
    }
    
    @Test
    void step_terminal() {
        assertThatThrownBy(() -> Resolver.step(new Resolver.Succeeded("x"), ctx("/")))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Not a synchronous state: Succeeded[value=x]");
    }
    
    @Test
    void step_child() {
        var child = Resources.of(Members.builder().build());
        var root = Resources.of(Members.builder().child("c", child).build());
        var s = Resolver.step(new Resolver.Descending(root, 0), ctx("/c/d"));
        assertThat(s).isEqualTo(new Resolver.Descending(child, 1));
    }
    
    @Test
    void step_redescending() {
        var s = Resolver.step(new Resolver.Redescending(HELLO, 2), ctx("/a/b"));
        assertThat(s).isEqualTo(new Resolver.Descending(HELLO, 2));
    }
    
    @Test
    void step_invoking() {
        var s = Resolver.step(new Resolver.Descending(HELLO, 0), ctx("/hello/John"));
        assertThat(s).isInstanceOf(Resolver.Invoking.class);
        var inv = (Resolver.Invoking) s;
        assertThat(inv.locates()).isFalse();
        assertThat(inv.resumeAt()).isEqualTo(2);
        assertThat(inv.args().get("name")).isEqualTo("John");
    }
    
    @Test
    void resume() {
        var args = new DefaultArguments(new LinkedHashMap<>(), Request.parse("/"));
        var page = new Resolver.Invoking(Page.builder().respond("x"), args, false, 1);
        var loc  = new Resolver.Invoking(Locator.builder().supply(a -> HELLO), args, true, 1);
        var ctx = ctx("/a/b");
        assertThat(Resolver.resume(page, null, ctx)).isEqualTo(new Resolver.Succeeded(null));
        assertThat(Resolver.resume(page, HELLO, ctx)).isEqualTo(new Resolver.Succeeded(HELLO));
        assertThat(Resolver.resume(loc, HELLO, ctx)).isEqualTo(new Resolver.Redescending(HELLO, 1));
        assertThat(Resolver.resume(loc, null, ctx)).isEqualTo(new Resolver.Failed("Locator yielded null."));
        assertThat(Resolver.resume(loc, "denied", ctx)).isEqualTo(new Resolver.Succeeded("denied"));
        assertThat(Resolver.resume(loc, new ShortCircuit(HELLO), ctx)).isEqualTo(new Resolver.Succeeded(HELLO));
    }
    
    @Test
    void cancelled_noStep() {
        var ctx = ctx("/hello/John");
        ctx.cancel();
        var stage = Resolver.resolve(HELLO, ctx).toCompletableFuture();
        assertThatThrownBy(stage::join)
                .isExactlyInstanceOf(CancellationException.class);
    }
    
    @Test
    void notFound_carriesTrace() {
        var stage = resolve(HELLO, "/hello").toCompletableFuture();
        var nf = (NotFoundException) catchThrowable(stage::join).getCause();
        assertThat(nf.getSegments()).containsExactly("hello");
        assertThat(nf.trace()).containsExactly(
                "\"hello\" selects PAGE",
                "No value for parameter \"name\".");
    }
    
    private static ResolutionContext ctx(String target) {
        return new ResolutionContext(Request.parse(target), true);
    }
    
    private static CompletionStage<Object> resolve(Resource root, String target) {
        return Resolver.resolve(root, ctx(target));
    }
}
