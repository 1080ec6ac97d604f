package alpha.treeroute.examples;

import alpha.treeroute.Site;
import alpha.treeroute.resource.Members;
import alpha.treeroute.resource.Page;
import alpha.treeroute.resource.Resource;

import static alpha.treeroute.resource.Parameter.positional;

/**
 * Greets the world, or someone in particular.<p>
 * 
 * <pre>
 *   /            Hello World!
 *   /hello/John  Hello John!
 *   /hello?name=John  Hello John!
 *   /hello       (not found)
 * </pre>
 * 
 * Run with a request target as the first argument:
 * <pre>
 *   java alpha.treeroute.examples.HelloWorld /hello/John
 * </pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HelloWorld implements Resource
{
    /**
     * Application entry point.
     * 
     * @param args first argument is the request target (default "/")
     */
    public static void main(String... args) {
        Object result = Site.create(new HelloWorld())
                .resolve(args.length == 0 ? "/" : args[0])
                .toCompletableFuture()
                .join();
        System.out.println(result);
    }
    
    private final Members members = Members.builder()
            .index(Page.builder().respond("Hello World!"))
            .page("hello", Page.builder()
                .param(positional("name"))
                .supply(args -> "Hello " + args.get("name") + "!"))
            .build();
    
    @Override
    public Members members() {
        return members;
    }
}
