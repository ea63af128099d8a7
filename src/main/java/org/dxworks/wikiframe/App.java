package org.dxworks.wikiframe;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dxworks.wikiframe.error.MWError;
import org.dxworks.wikiframe.error.WikiframeException;
import org.dxworks.wikiframe.model.Element;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "wikiframe", mixinStandardHelpOptions = true, version = "wikiframe 0.1.0",
        description = "Parses MediaWiki markup and prints the normalized syntax tree.")
public class App implements Callable<Integer> {

    private static final Logger LOG = LogManager.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_UNREADABLE = 2;

    @Option(names = {"-i", "--input"}, paramLabel = "<path>",
            description = "Wikitext file to parse (default: standard input)")
    Path input;

    @Option(names = "--json", description = "Print JSON instead of YAML")
    boolean json;

    @Option(names = "--no-position", description = "Omit source positions from the output")
    boolean noPosition;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final WikiframeConfig config;

    public App() {
        this(System.in, System.out, System.err, WikiframeConfig.load());
    }

    App(InputStream in, PrintStream out, PrintStream err, WikiframeConfig config) {
        this.in = in;
        this.out = out;
        this.err = err;
        this.config = config;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new App()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        String text;
        try {
            text = input == null
                    ? new String(in.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: Could not read input " + (input == null ? "<stdin>" : input) + ": " + e.getMessage());
            return EXIT_UNREADABLE;
        }

        TreeMapper mapper = json ? TreeMapper.json(!noPosition) : TreeMapper.yaml(!noPosition);
        try {
            Element tree = Wikiframe.parse(text, config);
            out.println(mapper.write(tree));
            return EXIT_OK;
        } catch (WikiframeException e) {
            MWError error = e.getError();
            LOG.info("Parsing {} failed: {}", input == null ? "<stdin>" : input, error.describe());
            err.println(error.render(config.getColor().ansi(), config.getTerminalWidth()));
            out.println(mapper.write(error));
            return EXIT_ERROR;
        }
    }
}
