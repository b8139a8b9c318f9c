package work.lcod.installer.runtime;

import java.util.List;

/**
 * One fragment of an installer script. Implementations only read the context.
 */
@FunctionalInterface
public interface ScriptGenerator {
    List<String> generate(BuildContext ctx);
}
