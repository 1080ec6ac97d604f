package alpha.treeroute.core;

import alpha.treeroute.Config;
import alpha.treeroute.NotFoundException;
import alpha.treeroute.PathRewriteException;
import alpha.treeroute.Site;
import alpha.treeroute.message.Request;
import alpha.treeroute.resource.Resource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Site}.<p>
 * 
 * Each root is tried in order using {@link Resolver}. A
 * {@code NotFoundException} moves on to the next root. A {@code
 * PathRewriteException} restarts the resolution from the first root with the
 * rewritten request, at most {@link Config#maxPathRewrites()} times. Anything
 * else completes the result.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultSite implements Site
{
    private static final System.Logger LOG
            = System.getLogger(DefaultSite.class.getPackageName());
    
    private final Config config;
    private final List<Resource> roots;
    
    DefaultSite(Config config, Resource first, Resource... more) {
        this.config = requireNonNull(config);
        var l = new ArrayList<Resource>(1 + more.length);
        l.add(first);
        l.addAll(List.of(more));
        this.roots = List.copyOf(l);
    }
    
    @Override
    public CompletionStage<Object> resolve(Request request) {
        requireNonNull(request);
        final var ctx = new ResolutionContext(request, config.traceResolution());
        final var result = new CompletableFuture<Object>();
        result.whenComplete((ign, ored) -> {
            if (result.isCancelled()) {
                ctx.cancel();
            }
        });
        start(ctx, result);
        return result;
    }
    
    private void start(ResolutionContext ctx, CompletableFuture<Object> result) {
        final int n = ctx.segments().size();
        if (n > config.maxPathSegments()) {
            ctx.trace(() -> "Path has " + n + " segments, max is " + config.maxPathSegments());
            notFound(ctx, result);
        } else {
            tryRoot(0, ctx, result);
        }
    }
    
    private void tryRoot(int i, ResolutionContext ctx, CompletableFuture<Object> result) {
        final Resource root = roots.get(i);
        ctx.trace(() -> "Root " + (i + 1) + " of " + roots.size() + ": " +
                        root.getClass().getName());
        
        Resolver.resolve(root, ctx).whenComplete((val, thr) -> {
            if (thr == null) {
                result.complete(val);
                return;
            }
            final Throwable t = unwrap(thr);
            if (ctx.isCancelled()) {
                result.completeExceptionally(t);
            } else if (t instanceof PathRewriteException pr) {
                rewrite(pr, ctx, result);
            } else if (!(t instanceof NotFoundException)) {
                result.completeExceptionally(t);
            } else if (i + 1 < roots.size()) {
                LOG.log(DEBUG, () -> "Root " + (i + 1) + " did not resolve " +
                        ctx.request().path() + ", trying next.");
                tryRoot(i + 1, ctx, result);
            } else {
                notFound(ctx, result);
            }
        });
    }
    
    /**
     * Restarts the resolution from the first root using the rewritten request
     * target.
     */
    private void rewrite(
            PathRewriteException e, ResolutionContext ctx, CompletableFuture<Object> result)
    {
        final String target = e.getRequestTarget();
        final int max = config.maxPathRewrites();
        if (ctx.rewrites() >= max) {
            result.completeExceptionally(new IllegalStateException(
                    "Path rewritten more than " + max + " times, last target: " + target, e));
            return;
        }
        final Request next;
        try {
            next = ctx.request().rewrite(target);
        } catch (IllegalArgumentException iae) {
            iae.addSuppressed(e);
            result.completeExceptionally(iae);
            return;
        }
        final String from = ctx.request().path();
        ctx.trace(() -> "Rewritten to " + target);
        LOG.log(DEBUG, () -> "Rewrote " + from + " to " + target);
        ctx.rewrite(next);
        start(ctx, result);
    }
    
    private static void notFound(ResolutionContext ctx, CompletableFuture<Object> result) {
        var nf = new NotFoundException(ctx.segments(), ctx.trace());
        LOG.log(DEBUG, () -> "Not found: " + nf.getPath() +
                (nf.trace().isEmpty() ? "" : "\n  " + String.join("\n  ", nf.trace())));
        result.completeExceptionally(nf);
    }
    
    private static Throwable unwrap(Throwable thr) {
        Throwable t = thr;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
    
    @Override
    public List<Resource> roots() {
        return roots;
    }
    
    @Override
    public Config config() {
        return config;
    }
    
    @Override
    public String toString() {
        return DefaultSite.class.getSimpleName() + "{" +
                "roots=" + roots.size() +
                ", config=" + config + '}';
    }
}
