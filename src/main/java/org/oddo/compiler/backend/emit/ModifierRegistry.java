package org.oddo.compiler.backend.emit;

import org.oddo.compiler.backend.emit.features.ComputedModifier;
import org.oddo.compiler.backend.emit.features.MutateModifier;
import org.oddo.compiler.backend.emit.features.ReactModifier;
import org.oddo.compiler.backend.emit.features.StateModifier;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for modifier rules, keyed by modifier name.
 */
public final class ModifierRegistry {

    private final Map<String, IModifierRule> rules = new LinkedHashMap<>();

    /**
     * Registers a new modifier rule. A rule with the same name replaces the earlier one.
     * @param rule The rule to register.
     */
    public void register(IModifierRule rule) { rules.put(rule.name(), rule); }

    /**
     * @param name The modifier name without {@code @}.
     * @return The rule for the name, if one is registered.
     */
    public Optional<IModifierRule> find(String name) { return Optional.ofNullable(rules.get(name)); }

    /**
     * Initializes a new modifier registry with the built-in modifiers.
     * @return A new registry with {@code state}, {@code computed}, {@code react} and {@code mutate}.
     */
    public static ModifierRegistry initializeWithDefaults() {
        ModifierRegistry reg = new ModifierRegistry();
        reg.register(new StateModifier());
        reg.register(new ComputedModifier());
        reg.register(new ReactModifier());
        reg.register(new MutateModifier());
        return reg;
    }
}
