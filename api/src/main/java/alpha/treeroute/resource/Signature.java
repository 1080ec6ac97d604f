package alpha.treeroute.resource;

import java.util.ArrayList;
import java.util.List;

import static alpha.treeroute.resource.Parameter.Kind.POSITIONAL;
import static alpha.treeroute.resource.Parameter.Kind.VAR_POSITIONAL;
import static java.text.MessageFormat.format;
import static java.util.Objects.requireNonNull;

/**
 * Accumulates and validates the parameters declared by a builder.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Signature
{
    private final List<Parameter> params = new ArrayList<>();
    
    void add(Parameter p) {
        requireNonNull(p);
        for (Parameter d : params) {
            if (d.name().equals(p.name())) {
                throw new IllegalArgumentException(format(
                        "Duplicate parameter name \"{0}\".", p.name()));
            }
            if (p.kind().isVariadic() && d.kind() == p.kind()) {
                throw new IllegalArgumentException(format(
                        "Parameter \"{0}\" is a second {1}, \"{2}\" came first.",
                        p.name(), p.kind(), d.name()));
            }
            if (p.kind() == POSITIONAL && d.kind() == VAR_POSITIONAL) {
                throw new IllegalArgumentException(format(
                        "Positional parameter \"{0}\" declared after {1} \"{2}\".",
                        p.name(), VAR_POSITIONAL, d.name()));
            }
        }
        params.add(p);
    }
    
    List<Parameter> toList() {
        return List.copyOf(params);
    }
}
