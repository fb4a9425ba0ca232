package com.jpyq;

import ch.qos.logback.classic.Level;
import com.jpyq.output.OutputFormatter;
import com.jpyq.query.QueryExecutor;
import com.jpyq.query.QueryNode;
import com.jpyq.query.QueryParser;
import com.jpyq.query.QueryResult;
import com.jpyq.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

@Command(name = "jpyq", mixinStandardHelpOptions = true, version = "1.0",
         description = "Query the structure of Python source with jq-like filters")
public class JPyQ implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(JPyQ.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "The filter to apply, e.g. 'find_function(main) | length'")
    private String filter;

    @Parameters(index = "1", arity = "0..1", description = "Input Python file (default: stdin)")
    private File inputFile;

    @Option(names = {"-a", "--ast"}, description = "Print syntax trees instead of source")
    private boolean astOutput = false;

    @Option(names = {"-c", "--compact"}, description = "Print syntax trees and JSON on a single line")
    private boolean compact = false;

    @Option(names = {"-j", "--json"}, description = "Print results as JSON")
    private boolean json = false;

    @Option(names = {"-v", "--verbose"}, description = "Log debug output to stderr")
    private boolean verbose = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JPyQ()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.jpyq")).setLevel(Level.DEBUG);
        }
        try {
            QueryNode query = new QueryParser().parse(filter);
            LOGGER.debug("Parsed query {}", query);

            Node input = Node.parse(readSource());

            OutputFormatter formatter = new OutputFormatter(astOutput, compact, json);
            try (Stream<QueryResult> results = new QueryExecutor().execute(query, input)) {
                results.forEach(result -> out.println(formatter.format(result)));
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            out.flush();
            err.println("Error: " + e.getMessage());
            err.flush();
            LOGGER.debug("Query failed", e);
            return 1;
        }
    }

    private String readSource() throws IOException {
        if (inputFile != null) {
            return Files.readString(inputFile.toPath(), StandardCharsets.UTF_8);
        }
        return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
