package alpha.treeroute.resource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static alpha.treeroute.resource.Parameter.Kind.POSITIONAL;
import static alpha.treeroute.resource.Parameter.Kind.VAR_POSITIONAL;
import static java.text.MessageFormat.format;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import static java.util.Optional.ofNullable;

/**
 * Default implementation of {@link Members}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultMembers implements Members
{
    private final Map<String, Object> named;
    private final Page index;
    private final Invocable fallback;
    
    private DefaultMembers(Map<String, Object> named, Page index, Invocable fallback) {
        this.named = named;
        this.index = index;
        this.fallback = fallback;
    }
    
    @Override
    public Optional<Page> page(String name) {
        return find(name, Page.class);
    }
    
    @Override
    public Optional<Resource> child(String name) {
        return find(name, Resource.class);
    }
    
    @Override
    public Optional<Locator> locator(String name) {
        return find(name, Locator.class);
    }
    
    private <T> Optional<T> find(String name, Class<T> type) {
        requireNonNull(name);
        Object m = named.get(name);
        return type.isInstance(m) ? Optional.of(type.cast(m)) : Optional.empty();
    }
    
    @Override
    public Optional<Page> index() {
        return ofNullable(index);
    }
    
    @Override
    public Optional<Invocable> fallback() {
        return ofNullable(fallback);
    }
    
    @Override
    public Set<String> names() {
        return named.keySet();
    }
    
    @Override
    public String toString() {
        return DefaultMembers.class.getSimpleName() + "{" +
                "names=" + named.keySet() +
                ", index=" + (index != null) +
                ", default=" + (fallback != null) + '}';
    }
    
    /**
     * Default implementation of {@link Members.Builder}.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    static final class Builder implements Members.Builder {
        // Page, Resource or Locator
        private final Map<String, Object> named = new LinkedHashMap<>();
        private Page index;
        private Invocable fallback;
        
        @Override
        public Builder page(String name, Page page) {
            requireNonNull(page);
            switch (requireValidName(name)) {
                case INDEX:
                    return index(page);
                case DEFAULT:
                    return fallback(page);
                default:
                    return add(name, page);
            }
        }
        
        @Override
        public Builder child(String name, Resource child) {
            requireNonNull(child);
            if (requireValidName(name).equals(INDEX) || name.equals(DEFAULT)) {
                throw new IllegalArgumentException(format(
                        "Slot \"{0}\" can not hold a child resource.", name));
            }
            return add(name, child);
        }
        
        @Override
        public Builder locator(String name, Locator locator) {
            requireNonNull(locator);
            switch (requireValidName(name)) {
                case INDEX:
                    throw new IllegalArgumentException(format(
                            "Slot \"{0}\" can only hold a page.", INDEX));
                case DEFAULT:
                    return fallback(locator);
                default:
                    return add(name, locator);
            }
        }
        
        @Override
        public Builder index(Page page) {
            requireNonNull(page);
            page.parameters().stream()
                .filter(p -> p.kind() == VAR_POSITIONAL)
                .findFirst()
                .ifPresent(p -> {
                    throw new IllegalArgumentException(format(
                        "Slot \"{0}\" never receives positional values, can not declare {1} \"{2}\".",
                        INDEX, VAR_POSITIONAL, p.name()));
                });
            if (index != null) {
                throw slotTaken(INDEX);
            }
            index = page;
            return this;
        }
        
        @Override
        public Builder fallback(Page page) {
            return setFallback(page);
        }
        
        @Override
        public Builder fallback(Locator locator) {
            return setFallback(locator);
        }
        
        private Builder setFallback(Invocable inv) {
            requireNonNull(inv);
            boolean positional = inv.parameters().stream().anyMatch(p ->
                    p.kind() == POSITIONAL || p.kind() == VAR_POSITIONAL);
            if (!positional) {
                throw new IllegalArgumentException(format(
                        "Slot \"{0}\" must declare a positional parameter for the unmatched segment.",
                        DEFAULT));
            }
            if (fallback != null) {
                throw slotTaken(DEFAULT);
            }
            fallback = inv;
            return this;
        }
        
        private Builder add(String name, Object member) {
            if (named.putIfAbsent(name, member) != null) {
                throw new MemberCollisionException(format(
                        "Member \"{0}\" is already registered.", name));
            }
            return this;
        }
        
        private static MemberCollisionException slotTaken(String slot) {
            return new MemberCollisionException(format(
                    "Slot \"{0}\" is already taken.", slot));
        }
        
        private static String requireValidName(String name) {
            if (name.isBlank()) {
                throw new IllegalArgumentException("Member name is blank.");
            }
            if (name.indexOf('/') != -1) {
                throw new IllegalArgumentException(format(
                        "Member name contains a forward slash: \"{0}\".", name));
            }
            return name;
        }
        
        @Override
        public Members build() {
            return new DefaultMembers(
                    unmodifiableMap(new LinkedHashMap<>(named)), index, fallback);
        }
    }
}
