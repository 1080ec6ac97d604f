package alpha.treeroute;

import alpha.treeroute.resource.Resource;

/**
 * Factory of {@code Site}.<p>
 * 
 * The library does not support custom implementations of the API, and
 * application code should have no use of this type. It is only public
 * because it is a requirement by Java's service-provider mechanism.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface SiteFactory
{
    /**
     * Creates a new {@code Site}.<p>
     * 
     * This method should only be used by the static method
     * {@link Site#create(Config, Resource, Resource...) Site.create()}.
     * 
     * @param config of site
     * @param first root
     * @param more roots
     * 
     * @return a new {@code Site}
     * 
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     */
    Site create(Config config, Resource first, Resource... more);
}
