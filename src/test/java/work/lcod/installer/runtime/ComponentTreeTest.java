package work.lcod.installer.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.installer.support.CompilerTestSupport;

class ComponentTreeTest {
    private static final String TREE = """
        app:
          name: Demo
        packages:
          core:
            sources: core.dll
          tools:
            description: Developer tools
            children:
              cli:
                sources: cli.exe
              extras:
                children:
                  plugins:
                    sources: plugins/**
                    description: Plugins
          docs:
            sources: docs.pdf
        """;

    @Test
    void assignsIdsInPreOrder() {
        var tree = ComponentTree.of(CompilerTestSupport.config(TREE).components());
        var sections = tree.sections().stream().map(node -> node.name() + "=" + node.id()).toList();
        assertEquals(List.of("core=SEC_PKG_0", "cli=SEC_PKG_1", "plugins=SEC_PKG_2", "docs=SEC_PKG_3"), sections);

        var tools = tree.roots().get(1);
        assertEquals(ComponentTree.Kind.GROUP, tools.kind());
        assertEquals("SEC_GROUP_0", tools.id());
        var extras = tools.children().get(1);
        assertEquals(ComponentTree.Kind.TRANSPARENT, extras.kind());
        assertEquals("", extras.id());
        assertEquals(2, extras.children().get(0).depth());
    }

    @Test
    void traversalIsRepeatable() {
        var components = CompilerTestSupport.config(TREE).components();
        var first = ComponentTree.of(components).nodes().stream().map(ComponentTree.Node::id).toList();
        var second = ComponentTree.of(components).nodes().stream().map(ComponentTree.Node::id).toList();
        assertEquals(first, second);
    }

    @Test
    void describedSkipsTransparentGroups() {
        var tree = ComponentTree.of(CompilerTestSupport.config(TREE).components());
        var described = tree.described().stream().map(ComponentTree.Node::id).toList();
        assertEquals(List.of("SEC_GROUP_0", "SEC_PKG_2"), described);
    }

    @Test
    void emptyTree() {
        assertTrue(ComponentTree.of(List.of()).isEmpty());
    }
}
