package alpha.treeroute.examples;

import alpha.treeroute.PathRewriteException;
import alpha.treeroute.Site;
import alpha.treeroute.resource.Locator;
import alpha.treeroute.resource.Members;
import alpha.treeroute.resource.Page;
import alpha.treeroute.resource.Resource;

import java.util.List;

import static alpha.treeroute.resource.Parameter.keywordOnly;
import static alpha.treeroute.resource.Parameter.positional;
import static alpha.treeroute.resource.Parameter.varPositional;

/**
 * A small forum, demonstrating locators, converters, path rewrites and
 * fallback roots.<p>
 * 
 * <pre>
 *   /                                 index
 *   /forum                            forums (rewritten to /forums)
 *   /forums                           forums
 *   /forum/12                         forum(12).index
 *   /forum?id=12                      forum(12).index
 *   /forum/12/topic/10                forum(12).topic(10)[0:10]
 *   /forum/12/topic/10?offset=20      forum(12).topic(10)[20:10]
 *   /forum/12/topic?topic=13&amp;num=5    forum(12).topic(13)[0:5]
 *   /forum/abc                        (not found, "abc" is not an int)
 *   /news                             all_news
 *   /archive/2019/03                  archive[2019, 03]
 * </pre>
 * 
 * The last two paths are not resolved by the forum application. They fall
 * through to the second root, {@link Legacy}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ForumSite implements Resource
{
    /**
     * Application entry point.
     * 
     * @param args first argument is the request target (default "/")
     */
    public static void main(String... args) {
        Object result = site()
                .resolve(args.length == 0 ? "/" : args[0])
                .toCompletableFuture()
                .join();
        System.out.println(result);
    }
    
    /**
     * Returns a site of the forum application, falling back to the legacy
     * application.
     * 
     * @return a site of the forum application
     */
    public static Site site() {
        return Site.create(new ForumSite(), new Legacy());
    }
    
    private final Members members = Members.builder()
            .index(Page.builder().respond("index"))
            .page("forums", Page.builder().respond("forums"))
            .locator("forum", Locator.builder()
                .param(positional("id", Integer::valueOf).withDefault(null))
                .supply(args -> {
                    Integer id = args.getAny("id");
                    if (id == null) {
                        throw new PathRewriteException("/forums");
                    }
                    return new Forum(id);
                }))
            .build();
    
    @Override
    public Members members() {
        return members;
    }
    
    /**
     * A forum of a particular id.
     */
    static final class Forum implements Resource {
        private final Members members;
        
        Forum(int id) {
            this.members = Members.builder()
                .index(Page.builder().supply(args -> "forum(" + id + ").index"))
                .page("topic", Page.builder()
                    .param(positional("topic", Integer::valueOf))
                    .param(keywordOnly("offset", Integer::valueOf).withDefault(0))
                    .param(keywordOnly("num", Integer::valueOf).withDefault(10))
                    .supply(args -> String.format("forum(%d).topic(%d)[%d:%d]",
                        id, args.get("topic"), args.get("offset"), args.get("num"))))
                .build();
        }
        
        @Override
        public Members members() {
            return members;
        }
    }
    
    /**
     * The application this forum replaced, still serving old links.
     */
    static final class Legacy implements Resource {
        private final Members members = Members.builder()
            .page("news", Page.builder().respond("all_news"))
            .page("archive", Page.builder()
                .param(varPositional("date"))
                .supply(args -> {
                    List<String> date = args.getAny("date");
                    return "archive" + date;
                }))
            .build();
        
        @Override
        public Members members() {
            return members;
        }
    }
}
