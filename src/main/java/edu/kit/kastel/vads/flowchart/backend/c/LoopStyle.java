package edu.kit.kastel.vads.flowchart.backend.c;

import java.util.Locale;

/// How the [CCodeGenerator] renders conditions that head a loop.
public enum LoopStyle {
    /// Every condition becomes an `if`/`else`; a loop body is emitted once, guarded by its condition.
    IF_ELSE,
    /// Back-edges are recognized and rendered as `while` and `do`/`while` loops.
    STRUCTURED;

    /// Parses the command line spelling, `if-else` or `structured`.
    public static LoopStyle fromOption(String option) {
        return LoopStyle.valueOf(option.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    public String option() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
