package io.synphot.core.obsmode;

/**
 * One graph-table edge: the node it leads to and the components it contributes. Component
 * names are {@code null} for {@code clear}.
 */
public record Transition(int nextNode, String opticalComponent, String thermalComponent) {

    @Override
    public String toString() {
        return "(" + nextNode + ", " + opticalComponent + ", " + thermalComponent + ")";
    }
}
