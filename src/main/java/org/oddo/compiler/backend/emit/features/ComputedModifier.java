package org.oddo.compiler.backend.emit.features;

/**
 * {@code @computed y = a + b} becomes {@code const y = $Oddo.computed((a, b) => a + b, [a, b])}.
 */
public class ComputedModifier extends DependencyTrackingModifier {

    @Override
    public String name() {
        return "computed";
    }
}
