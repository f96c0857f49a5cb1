package org.oddo.compiler.frontend.parser.ast;

/**
 * @param name The name bound to the remaining arguments.
 */
public record RestParameter(String name) implements Parameter {

    @Override
    public String type() {
        return "restElement";
    }
}
