package alpha.treeroute.message;

import alpha.treeroute.util.AbstractImmutableBuilder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Request}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultRequest implements Request
{
    private final List<String> segments;
    private final NamedValues body, namedValues;
    private final Attributes attributes;
    
    private DefaultRequest(DefaultBuilder.MutableState s) {
        this(s.segments, s.query, s.body, new DefaultAttributes());
        s.attributes.forEach(attributes::set);
    }
    
    private DefaultRequest(
            List<String> segments, NamedValues query, NamedValues body,
            Attributes attributes)
    {
        this.segments    = segments;
        this.body        = body;
        this.namedValues = query.append(body);
        this.attributes  = attributes;
    }
    
    @Override
    public List<String> segments() {
        return segments;
    }
    
    @Override
    public String path() {
        return "/" + String.join("/", segments);
    }
    
    @Override
    public NamedValues namedValues() {
        return namedValues;
    }
    
    @Override
    public Attributes attributes() {
        return attributes;
    }
    
    @Override
    public Request rewrite(String requestTarget) {
        var rt = RequestTarget.parse(requestTarget);
        return new DefaultRequest(rt.segments(), rt.query(), body, attributes);
    }
    
    @Override
    public String toString() {
        return DefaultRequest.class.getSimpleName() + "{" +
                "path=" + path() +
                ", namedValues=" + namedValues + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            List<String> segments = List.of();
            NamedValues  query    = NamedValues.empty(),
                         body     = NamedValues.empty();
            Map<String, Object> attributes = new LinkedHashMap<>();
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder target(String requestTarget) {
            var rt = RequestTarget.parse(requestTarget);
            return new DefaultBuilder(this, s -> {
                s.segments = rt.segments();
                s.query = rt.query();
            });
        }
        
        @Override
        public Builder segments(List<String> segments) {
            var copy = List.copyOf(segments);
            return new DefaultBuilder(this, s -> s.segments = copy);
        }
        
        @Override
        public Builder query(NamedValues query) {
            requireNonNull(query);
            return new DefaultBuilder(this, s -> s.query = query);
        }
        
        @Override
        public Builder body(NamedValues body) {
            requireNonNull(body);
            return new DefaultBuilder(this, s -> s.body = body);
        }
        
        @Override
        public Builder attribute(String name, Object value) {
            requireNonNull(name);
            requireNonNull(value);
            return new DefaultBuilder(this, s -> s.attributes.put(name, value));
        }
        
        @Override
        public Request build() {
            return new DefaultRequest(constructState(MutableState::new));
        }
    }
}
