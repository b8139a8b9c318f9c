package work.lcod.installer.nsis;

import work.lcod.installer.runtime.BuildContext;

/**
 * {@code File} directives and their uninstall counterparts for local sources.
 */
final class FileLines {
    private FileLines() {}

    static String install(BuildContext ctx, String source) {
        var path = HeaderFragments.filePath(ctx, source);
        if (source.contains("**")) {
            return "  File /r \"" + path + "\"";
        }
        return "  File \"" + path + "\"";
    }

    /**
     * Removal of what {@link #install} copied into {@code destination}. A recursive source ending in
     * a wildcard copies directory contents, so the whole destination goes.
     */
    static String remove(BuildContext ctx, String source, String destination) {
        var normalized = NsisText.normalizePath(ctx.resolve(source));
        if (source.contains("**")) {
            if (normalized.endsWith("*")) {
                return "  RMDir /r \"" + destination + "\"";
            }
            return "  RMDir /r \"" + destination + "\\" + NsisText.fileName(normalized) + "\"";
        }
        return "  Delete \"" + destination + "\\" + NsisText.fileName(normalized) + "\"";
    }

    static String removeRemote(BuildContext ctx, String url, String destination) {
        return "  Delete \"" + destination + "\\" + NsisText.fileName(ctx.resolve(url)) + "\"";
    }
}
