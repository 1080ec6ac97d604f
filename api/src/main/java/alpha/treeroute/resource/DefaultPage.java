package alpha.treeroute.resource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Page}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultPage implements Page
{
    private final List<Parameter> params;
    private final List<BeforeHook> before;
    private final List<AroundHook> around;
    private final List<AfterHook> after;
    private final Function<? super Arguments, ? extends CompletionStage<?>> logic;
    
    private DefaultPage(
            List<Parameter> params,
            List<BeforeHook> before,
            List<AroundHook> around,
            List<AfterHook> after,
            Function<? super Arguments, ? extends CompletionStage<?>> logic)
    {
        this.params = params;
        this.before = before;
        this.around = around;
        this.after  = after;
        this.logic  = logic;
    }
    
    @Override
    public List<Parameter> parameters() {
        return params;
    }
    
    @Override
    public CompletionStage<?> invoke(Arguments args) {
        return Hooks.around(before, around, logic, after, args, false);
    }
    
    @Override
    public String toString() {
        return DefaultPage.class.getSimpleName() + "{params=" + params + '}';
    }
    
    /**
     * Default implementation of {@link Page.Builder}.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    static final class Builder implements Page.Builder {
        private final Signature sig = new Signature();
        private final List<BeforeHook> before = new ArrayList<>();
        private final List<AroundHook> around = new ArrayList<>();
        private final List<AfterHook> after = new ArrayList<>();
        
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
        public Builder after(AfterHook hook) {
            after.add(requireNonNull(hook));
            return this;
        }
        
        @Override
        public Page apply(Function<? super Arguments, ? extends CompletionStage<?>> logic) {
            requireNonNull(logic);
            return new DefaultPage(
                    sig.toList(),
                    List.copyOf(before), List.copyOf(around), List.copyOf(after),
                    logic);
        }
    }
}
