package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.ScriptBackend;
import work.lcod.installer.runtime.ScriptGenerator;

/**
 * NSIS backend: concatenates the script fragments in their fixed order, drops directives the
 * custom finish page replaces and applies the {@link ReorderPass}.
 */
public final class NsisScriptGenerator implements ScriptBackend {
    private static final Logger log = LoggerFactory.getLogger(NsisScriptGenerator.class);

    /** Directive prefixes superseded by the custom launch function on the finish page. */
    static final List<String> OVERRIDDEN_DIRECTIVES = List.of("!define MUI_FINISHPAGE_RUN");

    private static final List<ScriptGenerator> FRAGMENTS = List.of(
        HeaderFragments::header,
        HeaderFragments::customIncludes,
        HeaderFragments::generalSettings,
        ModernUiFragment::generate,
        PolicyFragments::signing,
        PolicyFragments::update,
        HelperRoutines::logMacros,
        HelperRoutines::pathHelpers,
        InstallSection::generate,
        ComponentSections::sections,
        ComponentSections::descriptions,
        UninstallSection::generate,
        ExistingInstallHelpers::generate,
        InitCallbacks::onInstSuccess,
        InitCallbacks::onInit,
        InitCallbacks::unOnInit,
        HelperRoutines::checksumHelpers
    );

    @Override
    public Dialect dialect() {
        return Dialect.NSIS;
    }

    @Override
    public List<String> assemble(BuildContext ctx) {
        var parts = new ArrayList<String>();
        for (var fragment : FRAGMENTS) {
            parts.addAll(fragment.generate(ctx));
        }
        var lines = new ArrayList<String>(parts.size());
        for (var part : dropOverridden(parts)) {
            lines.addAll(Arrays.asList(part.split("\n", -1)));
        }
        log.debug("Assembled {} NSIS lines from {} fragments", lines.size(), FRAGMENTS.size());
        return ReorderPass.apply(lines);
    }

    static List<String> dropOverridden(List<String> lines) {
        var kept = new ArrayList<String>(lines.size());
        for (var line : lines) {
            var stripped = line.strip();
            if (OVERRIDDEN_DIRECTIVES.stream().noneMatch(stripped::startsWith)) {
                kept.add(line);
            }
        }
        return kept;
    }
}
