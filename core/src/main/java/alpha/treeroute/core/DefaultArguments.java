package alpha.treeroute.core;

import alpha.treeroute.message.Request;
import alpha.treeroute.resource.Arguments;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Arguments}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultArguments implements Arguments
{
    private final Map<String, Object> values;
    private final Request request;
    
    DefaultArguments(LinkedHashMap<String, Object> values, Request request) {
        this.values  = unmodifiableMap(values);
        this.request = request;
    }
    
    @Override
    public Object get(String name) {
        requireNonNull(name);
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException(
                    "No parameter named \"" + name + "\".");
        }
        return values.get(name);
    }
    
    @Override
    public <V> V getAny(String name) {
        @SuppressWarnings("unchecked")
        V v = (V) get(name);
        return v;
    }
    
    @Override
    public DefaultArguments with(String name, Object value) {
        get(name);
        var copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new DefaultArguments(copy, request);
    }
    
    @Override
    public Map<String, Object> asMap() {
        return values;
    }
    
    @Override
    public Request request() {
        return request;
    }
    
    @Override
    public String toString() {
        return values.toString();
    }
}
