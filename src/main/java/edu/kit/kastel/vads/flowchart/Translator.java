package edu.kit.kastel.vads.flowchart;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.flowchart.backend.c.CCodeGenerator;
import edu.kit.kastel.vads.flowchart.backend.c.LoopStyle;
import edu.kit.kastel.vads.flowchart.ir.FlowGraph;
import edu.kit.kastel.vads.flowchart.lexer.LexException;
import edu.kit.kastel.vads.flowchart.lexer.Lexer;
import edu.kit.kastel.vads.flowchart.parser.ParseException;
import edu.kit.kastel.vads.flowchart.parser.Parser;
import edu.kit.kastel.vads.flowchart.parser.TokenSource;

/// Runs the whole pipeline for one source unit: lexing, graph construction and C generation.
///
/// A translation either completes or throws; no partial graph or code is handed out. Every call works on its own
/// lexer, parser and graph, so a translator can be shared between threads.
public class Translator {
    private static final Logger LOGGER = LoggerFactory.getLogger(Translator.class);

    private final CCodeGenerator generator;

    public Translator() {
        this(LoopStyle.IF_ELSE);
    }

    public Translator(LoopStyle loopStyle) {
        this.generator = new CCodeGenerator(loopStyle);
    }

    /// @throws LexException if the source contains an illegal character
    /// @throws ParseException if the source does not match the grammar
    public FlowGraph buildGraph(String source) {
        Lexer lexer = Lexer.forString(source);
        TokenSource tokenSource = new TokenSource(lexer);
        Parser parser = new Parser(tokenSource);
        FlowGraph graph = parser.parseProgram();
        LOGGER.debug("built {}", graph);
        return graph;
    }

    /// @throws LexException if the source contains an illegal character
    /// @throws ParseException if the source does not match the grammar
    public Translation translate(String source) {
        FlowGraph graph = buildGraph(source);
        String code = this.generator.generateCode(graph);
        LOGGER.debug("generated {} lines of C", code.lines().count());
        return new Translation(graph, code);
    }
}
