package alpha.treeroute.testutil;

import alpha.treeroute.Site;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;

import static alpha.treeroute.testutil.LogRecords.toJUL;
import static java.lang.System.Logger.Level;

/**
 * Logging utilities.<p>
 * 
 * The library logs through {@code System.Logger}, which by default is backed
 * by JUL. All methods of this class operate on the JUL logger named after
 * the package of a given component. Loggers of sub-packages inherit the
 * level and handlers of the parent, so a test interested in all records of
 * the library may use {@code Site.class} as the component.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Logging
{
    private Logging() {
        // Empty
    }
    
    // JUL keeps only weak references to loggers, a level set on a collected
    // logger would be lost
    private static final Map<String, Logger> KEEP = new ConcurrentHashMap<>();
    
    /**
     * Sets the logging level of the package that the component belongs to.<p>
     * 
     * If no console handler with the given level exists, one is installed on
     * the package logger, so that the records show up in the test output.
     * 
     * @param component to extract package from
     * @param level to set
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static void setLevel(Class<?> component, Level level) {
        final java.util.logging.Level impl = toJUL(level);
        Logger l = logger(component);
        l.setLevel(impl);
        
        boolean found = false;
        for (Handler h : l.getHandlers()) {
            if (h instanceof ConsoleHandler) {
                h.setLevel(impl);
                found = true;
            }
        }
        if (!found) {
            Handler h = new ConsoleHandler();
            h.setFormatter(new LogRecords.CompactFormatter());
            h.setLevel(impl);
            l.addHandler(h);
            l.setUseParentHandlers(false);
        }
    }
    
    /**
     * Log everything.<p>
     * 
     * This method is equivalent to:
     * 
     * <pre>
     *     Logging.{@link #setLevel(Class, Level)
     *       setLevel}(Site.class, Level.ALL);
     * </pre>
     */
    public static void everything() {
        setLevel(Site.class, Level.ALL);
    }
    
    static Logger logger(Class<?> component) {
        return KEEP.computeIfAbsent(component.getPackageName(), Logger::getLogger);
    }
}
