package work.lcod.installer.errors;

/**
 * Base failure of a compilation run, carrying a stable code plus structured data for callers.
 */
public class CompilerException extends RuntimeException {
    private final String code;
    private final Object data;

    public CompilerException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
