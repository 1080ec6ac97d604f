package alpha.treeroute.core;

import alpha.treeroute.Config;
import alpha.treeroute.Site;
import alpha.treeroute.SiteFactory;
import alpha.treeroute.resource.Resource;

/**
 * Creates {@link DefaultSite}s.<p>
 * 
 * Registered as a service provider of {@link SiteFactory}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class DefaultSiteFactory implements SiteFactory
{
    /**
     * Constructs a {@code DefaultSiteFactory}.<p>
     * 
     * Required by {@code java.util.ServiceLoader}.
     */
    public DefaultSiteFactory() {
        // Empty
    }
    
    @Override
    public Site create(Config config, Resource first, Resource... more) {
        return new DefaultSite(config, first, more);
    }
}
