package work.lcod.installer.errors;

import java.util.List;

public final class MissingTranslationException extends CompilerException {
    private final String language;

    public MissingTranslationException(String field, String language, List<String> available) {
        super(
            "missing_translation",
            "Missing translation for " + field + ": '" + language + "'. Available: " + String.join(", ", available),
            List.copyOf(available)
        );
        this.language = language;
    }

    public String language() {
        return language;
    }
}
