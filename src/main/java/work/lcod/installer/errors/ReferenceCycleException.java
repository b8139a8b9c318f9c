package work.lcod.installer.errors;

import java.util.List;

/**
 * A path reference was reached again while it was still being resolved.
 */
public final class ReferenceCycleException extends CompilerException {
    public ReferenceCycleException(List<String> chain) {
        super("reference_cycle", "Circular reference detected: " + String.join(" → ", chain), List.copyOf(chain));
    }

    @SuppressWarnings("unchecked")
    public List<String> chain() {
        return (List<String>) data();
    }
}
