package org.oddo.compiler.backend.emit.features;

/**
 * {@code @react log(a)} becomes {@code $Oddo.react((log, a) => log(a), [log, a])}.
 */
public class ReactModifier extends DependencyTrackingModifier {

    @Override
    public String name() {
        return "react";
    }
}
