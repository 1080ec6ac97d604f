package alpha.treeroute.resource;

import static java.util.Objects.requireNonNull;

/**
 * A parameter declared by a page or locator.<p>
 * 
 * Parameters are bound in declaration order. What a parameter receives is
 * decided by its {@link Kind kind}:
 * 
 * <pre>{@code
 *   Page topic = Page.builder()
 *       .param(Parameter.positional("id", Integer::valueOf))          // path segment or ?id=
 *       .param(Parameter.keywordOnly("offset", Integer::valueOf)
 *                       .withDefault(0))                               // only ?offset=
 *       .param(Parameter.varKeyword("rest"))                          // all other named values
 *       .supply(args -> ...);
 * }</pre>
 * 
 * A raw value is passed through the parameter's {@link Converter}. A default
 * value is used as is and is never converted.<p>
 * 
 * Parameters are immutable.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Parameter
{
    /**
     * The kind of parameter.
     */
    public enum Kind {
        /**
         * Receives the next positional value (path segment). If none is left,
         * receives the named value of the same name.
         */
        POSITIONAL,
        /**
         * Receives only the named value of the same name.
         */
        KEYWORD_ONLY,
        /**
         * Receives all remaining positional values as a
         * {@code List}, possibly empty.
         */
        VAR_POSITIONAL,
        /**
         * Receives all named values not claimed by another parameter, as a
         * {@code Map<String, String>}, possibly empty.
         */
        VAR_KEYWORD;
        
        /**
         * Returns {@code true} if this kind is {@code VAR_POSITIONAL} or
         * {@code VAR_KEYWORD}.
         * 
         * @return {@code true} if this kind is {@code VAR_POSITIONAL} or
         *         {@code VAR_KEYWORD}
         */
        public boolean isVariadic() {
            return this == VAR_POSITIONAL || this == VAR_KEYWORD;
        }
    }
    
    /**
     * Creates a positional parameter receiving a string.
     * 
     * @param name of parameter
     * 
     * @return a new parameter
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public static Parameter positional(String name) {
        return positional(name, Converter.identity());
    }
    
    /**
     * Creates a positional parameter.
     * 
     * @param name of parameter
     * @param converter of raw value
     * 
     * @return a new parameter
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public static Parameter positional(String name, Converter<?> converter) {
        return new Parameter(name, Kind.POSITIONAL, converter, false, null);
    }
    
    /**
     * Creates a keyword-only parameter receiving a string.
     * 
     * @param name of parameter
     * 
     * @return a new parameter
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public static Parameter keywordOnly(String name) {
        return keywordOnly(name, Converter.identity());
    }
    
    /**
     * Creates a keyword-only parameter.
     * 
     * @param name of parameter
     * @param converter of raw value
     * 
     * @return a new parameter
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public static Parameter keywordOnly(String name, Converter<?> converter) {
        return new Parameter(name, Kind.KEYWORD_ONLY, converter, false, null);
    }
    
    /**
     * Creates a variadic positional parameter receiving a list of strings.
     * 
     * @param name of parameter
     * 
     * @return a new parameter
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public static Parameter varPositional(String name) {
        return varPositional(name, Converter.identity());
    }
    
    /**
     * Creates a variadic positional parameter.<p>
     * 
     * The converter is applied to each element.
     * 
     * @param name of parameter
     * @param converter of each raw value
     * 
     * @return a new parameter
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public static Parameter varPositional(String name, Converter<?> converter) {
        return new Parameter(name, Kind.VAR_POSITIONAL, converter, false, null);
    }
    
    /**
     * Creates a variadic keyword parameter.<p>
     * 
     * The parameter receives a {@code Map<String, String>} of each unclaimed
     * name to its last value.
     * 
     * @param name of parameter
     * 
     * @return a new parameter
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public static Parameter varKeyword(String name) {
        return new Parameter(name, Kind.VAR_KEYWORD, Converter.identity(), false, null);
    }
    
    private final String name;
    private final Kind kind;
    private final Converter<?> converter;
    private final boolean hasDefault;
    private final Object defaultValue;
    
    private Parameter(
            String name, Kind kind, Converter<?> converter,
            boolean hasDefault, Object defaultValue)
    {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name is blank.");
        }
        this.name = name;
        this.kind = kind;
        this.converter = requireNonNull(converter);
        this.hasDefault = hasDefault;
        this.defaultValue = defaultValue;
    }
    
    /**
     * Returns a copy of this parameter with the given default value.<p>
     * 
     * The default is used when no value is available for the parameter. It is
     * passed to the page as is, not through the converter.
     * 
     * @param value default (may be {@code null})
     * 
     * @return a new parameter
     * 
     * @throws IllegalArgumentException if this parameter is variadic
     */
    public Parameter withDefault(Object value) {
        if (kind.isVariadic()) {
            throw new IllegalArgumentException(
                    "Variadic parameter \"" + name + "\" can not have a default value.");
        }
        return new Parameter(name, kind, converter, true, value);
    }
    
    /**
     * Returns the name.
     * 
     * @return the name
     */
    public String name() {
        return name;
    }
    
    /**
     * Returns the kind.
     * 
     * @return the kind
     */
    public Kind kind() {
        return kind;
    }
    
    /**
     * Returns the converter.
     * 
     * @return the converter
     */
    public Converter<?> converter() {
        return converter;
    }
    
    /**
     * Returns {@code true} if this parameter has a default value.
     * 
     * @return {@code true} if this parameter has a default value
     */
    public boolean hasDefault() {
        return hasDefault;
    }
    
    /**
     * Returns the default value.
     * 
     * @return the default value (may be {@code null})
     * 
     * @throws IllegalStateException if there is no default value
     */
    public Object defaultValue() {
        if (!hasDefault) {
            throw new IllegalStateException(
                    "Parameter \"" + name + "\" has no default value.");
        }
        return defaultValue;
    }
    
    @Override
    public String toString() {
        return Parameter.class.getSimpleName() + "{" +
                "name=" + name +
                ", kind=" + kind +
                (hasDefault ? ", default=" + defaultValue : "") + '}';
    }
}
