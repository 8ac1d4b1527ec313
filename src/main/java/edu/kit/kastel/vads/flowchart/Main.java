package edu.kit.kastel.vads.flowchart;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.flowchart.backend.c.LoopStyle;
import edu.kit.kastel.vads.flowchart.ir.util.GraphVizPrinter;
import edu.kit.kastel.vads.flowchart.lexer.LexException;
import edu.kit.kastel.vads.flowchart.parser.ParseException;

public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final int EXIT_USAGE = 3;
    static final int EXIT_TRANSLATION_ERROR = 42;

    private static final String USAGE =
        "Usage: Main [--loops=if-else|structured] [--dot <file>] <input> <output>";

    public static void main(String[] args) throws IOException {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) throws IOException {
        LoopStyle loopStyle = LoopStyle.IF_ELSE;
        @Nullable Path dotOutput = null;
        List<String> files = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--loops=")) {
                try {
                    loopStyle = LoopStyle.fromOption(arg.substring("--loops=".length()));
                } catch (IllegalArgumentException e) {
                    System.err.println("Invalid loop style in " + arg);
                    System.err.println(USAGE);
                    return EXIT_USAGE;
                }
            } else if (arg.equals("--dot")) {
                if (i + 1 >= args.length) {
                    System.err.println("Missing file after --dot");
                    System.err.println(USAGE);
                    return EXIT_USAGE;
                }
                dotOutput = Path.of(args[++i]);
            } else if (arg.startsWith("--")) {
                System.err.println("Unknown option " + arg);
                System.err.println(USAGE);
                return EXIT_USAGE;
            } else {
                files.add(arg);
            }
        }
        if (files.size() != 2) {
            System.err.println("Invalid arguments: Expected one input file and one output file");
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        Path input = Path.of(files.get(0));
        Path output = Path.of(files.get(1));

        Translation translation;
        try {
            translation = new Translator(loopStyle).translate(Files.readString(input));
        } catch (LexException | ParseException e) {
            LOGGER.error("{}: {}", input, e.getMessage());
            return EXIT_TRANSLATION_ERROR;
        }
        Files.writeString(output, translation.code() + "\n");
        LOGGER.info("wrote {} ({} loops)", output, loopStyle.option());
        if (dotOutput != null) {
            Files.writeString(dotOutput, GraphVizPrinter.print(translation.graph()));
            LOGGER.info("wrote {}", dotOutput);
        }
        return 0;
    }
}
