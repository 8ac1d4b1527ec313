package edu.kit.kastel.vads.flowchart;

/// A location in the source text. Lines and columns both start at 1.
public sealed interface Position {
    int line();

    int column();

    record SimplePosition(int line, int column) implements Position {
        @Override
        public String toString() {
            return line() + ":" + column();
        }
    }
}
