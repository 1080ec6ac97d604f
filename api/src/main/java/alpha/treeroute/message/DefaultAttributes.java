package alpha.treeroute.message;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Optional.ofNullable;

/**
 * Default implementation of {@link Attributes}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultAttributes implements Attributes
{
    // Rejects null keys and values
    private final ConcurrentMap<String, Object> map = new ConcurrentHashMap<>();
    
    @Override
    public Object get(String name) {
        return map.get(name);
    }
    
    @Override
    public Object set(String name, Object value) {
        return map.put(name, value);
    }
    
    @Override
    public <V> V getAny(String name) {
        @SuppressWarnings("unchecked")
        V v = (V) map.get(name);
        return v;
    }
    
    @Override
    public Optional<Object> getOpt(String name) {
        return ofNullable(get(name));
    }
    
    @Override
    public ConcurrentMap<String, Object> asMap() {
        return map;
    }
    
    @Override
    public String toString() {
        return map.toString();
    }
}
