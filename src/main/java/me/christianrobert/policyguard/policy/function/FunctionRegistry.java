package me.christianrobert.policyguard.policy.function;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable name to {@link PolicyFunction} lookup. Safe to share between threads.
 */
public class FunctionRegistry {

    private final Map<String, PolicyFunction> functions;

    private FunctionRegistry(Map<String, PolicyFunction> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    /**
     * Registry holding the built-in functions only.
     */
    public static FunctionRegistry builtins() {
        return builder().registerBuiltins().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the function, or {@code null} when none is registered under that name
     */
    public PolicyFunction get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> getNames() {
        return functions.keySet();
    }

    public static class Builder {
        private final Map<String, PolicyFunction> functions = new LinkedHashMap<>();

        public Builder registerBuiltins() {
            BuiltinFunctions.registerAll(this);
            return this;
        }

        /**
         * Registers a function, replacing any previous one with the same name.
         */
        public Builder register(String name, PolicyFunction function) {
            functions.put(name, function);
            return this;
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(functions);
        }
    }
}
