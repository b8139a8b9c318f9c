package work.lcod.installer.errors;

public final class ResolutionDepthException extends CompilerException {
    public ResolutionDepthException(int maxDepth, String text) {
        super(
            "resolution_depth",
            "Variable resolution exceeded max depth (" + maxDepth + "). Possible circular reference in: " + text,
            maxDepth
        );
    }
}
