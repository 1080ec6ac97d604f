package alpha.treeroute.resource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Locator}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultLocator implements Locator
{
    private final List<Parameter> params;
    private final List<BeforeHook> before;
    private final List<AroundHook> around;
    private final Function<? super Arguments, ? extends CompletionStage<? extends Resource>> logic;
    
    private DefaultLocator(
            List<Parameter> params,
            List<BeforeHook> before,
            List<AroundHook> around,
            Function<? super Arguments, ? extends CompletionStage<? extends Resource>> logic)
    {
        this.params = params;
        this.before = before;
        this.around = around;
        this.logic  = logic;
    }
    
    @Override
    public List<Parameter> parameters() {
        return params;
    }
    
    @Override
    public CompletionStage<?> invoke(Arguments args) {
        return Hooks.around(before, around, logic, List.of(), args, true);
    }
    
    @Override
    public String toString() {
        return DefaultLocator.class.getSimpleName() + "{params=" + params + '}';
    }
    
    /**
     * Default implementation of {@link Locator.Builder}.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    static final class Builder implements Locator.Builder {
        private final Signature sig = new Signature();
        private final List<BeforeHook> before = new ArrayList<>();
        private final List<AroundHook> around = new ArrayList<>();
        
        @Override
        public Builder param(Parameter param) {
            sig.add(param);
            return this;
        }
        
        @Override
        public Builder before(BeforeHook hook) {
            before.add(requireNonNull(hook));
            return this;
        }
        
        @Override
        public Builder around(AroundHook hook) {
            around.add(requireNonNull(hook));
            return this;
        }
        
        @Override
        public Locator apply(
                Function<? super Arguments, ? extends CompletionStage<? extends Resource>> logic) {
            requireNonNull(logic);
            return new DefaultLocator(
                    sig.toList(), List.copyOf(before), List.copyOf(around), logic);
        }
    }
}
