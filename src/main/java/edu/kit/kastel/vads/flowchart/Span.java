package edu.kit.kastel.vads.flowchart;

public sealed interface Span {
    Position start();

    Position end();

    record SimpleSpan(Position start, Position end) implements Span {
        @Override
        public String toString() {
            return "[" + start() + "|" + end() + "]";
        }
    }
}
