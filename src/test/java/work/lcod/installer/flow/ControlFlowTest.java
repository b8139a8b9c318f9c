package work.lcod.installer.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ControlFlowTest {
    @Test
    void labelsOnlyJumpTargets() {
        var flow = ControlFlow.builder("_t_")
            .state("check", List.of("Pop $0"), ControlFlow.branch("StrCmp $0 \"\" {0}", "work", "skip"))
            .state("work", List.of("DetailPrint \"work\""), ControlFlow.next())
            .state("skip", ControlFlow.next())
            .build();
        assertEquals(List.of(
            "  Pop $0",
            "  StrCmp $0 \"\" _t_skip",
            "  DetailPrint \"work\"",
            "_t_skip:"
        ), flow.emit(""));
    }

    @Test
    void unreachableStatesAreDropped() {
        var flow = ControlFlow.builder("_g_")
            .state("start", ControlFlow.jump("end"))
            .state("middle", ControlFlow.jump("start"))
            .state("end", List.of("Nop"), ControlFlow.next())
            .build();
        var lines = flow.emit("");
        // middle is unreachable and dropped, so start falls into end
        assertEquals(List.of("  Nop"), lines);
        assertEquals(List.of("start", "end"), flow.reachableStates());
    }

    @Test
    void otherwiseGetsAGotoWhenNotAdjacent() {
        var flow = ControlFlow.builder("_o_")
            .state("a", ControlFlow.branch("IfErrors {0}", "c", "b"))
            .state("b", ControlFlow.stop("Abort"))
            .state("c", List.of("Nop"), ControlFlow.next())
            .build();
        assertEquals(List.of(
            "  IfErrors _o_b",
            "  Goto _o_c",
            "_o_b:",
            "  Abort",
            "_o_c:",
            "  Nop"
        ), flow.emit(""));
    }

    @Test
    void everyEmittedLabelIsUniqueAndUsed() {
        var flow = ControlFlow.builder("_l_")
            .state("loop", List.of("Sleep 10"), ControlFlow.branch("IfFileExists x {0}", "done", "loop"))
            .state("done", ControlFlow.next())
            .build();
        var lines = flow.emit("");
        assertTrue(lines.contains("_l_loop:"));
        assertTrue(lines.contains("  IfFileExists x _l_loop"));
        assertFalse(lines.contains("_l_done:"));
    }

    @Test
    void rejectsUnknownTargets() {
        var builder = ControlFlow.builder("_x_")
            .state("a", ControlFlow.jump("missing"));
        var error = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(error.getMessage().contains("missing"));
    }

    @Test
    void rejectsDuplicateStates() {
        var builder = ControlFlow.builder("_d_")
            .state("a", ControlFlow.next())
            .state("a", ControlFlow.next());
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void rejectsInvalidLabels() {
        var builder = ControlFlow.builder("bad prefix ")
            .state("a", ControlFlow.next());
        assertThrows(IllegalStateException.class, builder::build);
    }
}
