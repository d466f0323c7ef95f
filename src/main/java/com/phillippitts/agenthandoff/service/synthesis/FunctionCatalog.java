package com.phillippitts.agenthandoff.service.synthesis;

import com.phillippitts.agenthandoff.domain.FunctionSpec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of function definitions by name.
 */
public final class FunctionCatalog {

    private final Map<String, FunctionSpec> functions;

    public FunctionCatalog(Map<String, FunctionSpec> functions) {
        this.functions = Map.copyOf(new LinkedHashMap<>(functions));
    }

    public Optional<FunctionSpec> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public int size() {
        return functions.size();
    }
}
