package work.lcod.installer.runtime;

import java.util.List;
import work.lcod.installer.api.Dialect;

/**
 * Produces the complete script lines for one dialect, before the final substitution sweep.
 */
public interface ScriptBackend {
    Dialect dialect();

    List<String> assemble(BuildContext ctx);
}
