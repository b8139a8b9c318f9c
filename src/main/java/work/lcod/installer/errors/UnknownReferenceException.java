package work.lcod.installer.errors;

import java.util.List;

/**
 * Raised only by strict validation; the lenient path lets unknown references through.
 */
public final class UnknownReferenceException extends CompilerException {
    public UnknownReferenceException(String message, List<String> unknown) {
        super("unknown_reference", message, List.copyOf(unknown));
    }

    @SuppressWarnings("unchecked")
    public List<String> unknown() {
        return (List<String>) data();
    }
}
