package edu.kit.kastel.vads.flowchart.parser;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/// Spells statements of the source language as C statements.
public final class TargetSyntax {

    private TargetSyntax() {
    }

    public static String assignment(String variable, String expression) {
        return variable + " = " + expression + ";";
    }

    /// One `printf` printing every argument as an integer, separated by single spaces.
    public static String print(List<String> arguments, boolean newline) {
        String format = String.join(" ", Collections.nCopies(arguments.size(), "%d"));
        if (newline) {
            format += "\\n";
        }
        return "printf(\"" + format + "\", " + String.join(", ", arguments) + ");";
    }

    /// One `scanf` per variable, in the given order.
    public static String scan(List<String> variables) {
        return variables.stream()
            .map(variable -> "scanf(\"%d\", &" + variable + ");")
            .collect(Collectors.joining(" "));
    }

    public static String forInit(String variable, String from) {
        return assignment(variable, from);
    }

    public static String forCondition(String variable, String to, boolean downTo) {
        return variable + (downTo ? " >= " : " <= ") + to;
    }

    public static String forStep(String variable, boolean downTo) {
        return variable + (downTo ? "--;" : "++;");
    }
}
