package com.startsmart.app;

import com.startsmart.config.Config;
import com.startsmart.core.ConfigurationException;
import com.startsmart.core.DataIntegrityException;
import com.startsmart.core.NotFoundException;
import com.startsmart.model.Explanation;
import com.startsmart.model.ProcessingMode;
import com.startsmart.model.Recommendation;
import com.startsmart.pipeline.RecommendationJson;
import com.startsmart.pipeline.RecommendationPipeline;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class StartSmartApplication {
    private static final Logger LOG = LogManager.getLogger(StartSmartApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CONFIG = 3;

    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final PrintStream out;
    private final boolean routeLogs;

    public StartSmartApplication() {
        this(System.out, true);
    }

    StartSmartApplication(PrintStream out, boolean routeLogs) {
        this.out = out;
        this.routeLogs = routeLogs;
    }

    public static void main(String[] args) {
        int exit = new StartSmartApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("startsmart", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help") || !(cmd.hasOption("rank") || cmd.hasOption("evaluate") || cmd.hasOption("explain"))) {
            new HelpFormatter().printHelp("startsmart", options);
            return cmd.hasOption("help") ? EXIT_OK : EXIT_USAGE;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        try {
            Config config = Config.load(workingDir);
            if (routeLogs) {
                installLogRoutingIfNeeded(config);
            }
            return run(cmd, config);
        } catch (NotFoundException | IllegalArgumentException e) {
            LOG.error("request rejected: {}", e.getMessage());
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (ConfigurationException | DataIntegrityException e) {
            LOG.error("engine cannot start: {}", e.getMessage(), e);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (Exception e) {
            LOG.error("unexpected failure", e);
            System.err.println("FATAL: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    int run(CommandLine cmd, Config config) {
        try (RecommendationPipeline pipeline = EngineWiring.pipeline(config)) {
            return run(cmd, pipeline);
        }
    }

    int run(CommandLine cmd, RecommendationPipeline pipeline) {
        ProcessingMode mode = ProcessingMode.parse(cmd.getOptionValue("mode"));
        if (cmd.hasOption("rank")) {
            String region = required(cmd, "region");
            String category = required(cmd, "category");
            int limit = parseInt(cmd.getOptionValue("limit", "10"), "limit");
            List<Recommendation> results = pipeline.rank(region, category, limit, mode);
            out.println(RecommendationJson.toJson(results).toString(2));
            return EXIT_OK;
        }
        if (cmd.hasOption("evaluate")) {
            double lat = parseDouble(required(cmd, "lat"), "lat");
            double lon = parseDouble(required(cmd, "lon"), "lon");
            Recommendation result = cmd.hasOption("radius")
                    ? pipeline.evaluate(lat, lon, parseDouble(cmd.getOptionValue("radius"), "radius"), mode)
                    : pipeline.evaluate(lat, lon, mode);
            out.println(RecommendationJson.toJson(result).toString(2));
            return EXIT_OK;
        }
        Explanation explanation = pipeline.explain(required(cmd, "grid"), required(cmd, "category"));
        out.println(RecommendationJson.toJson(explanation).toString(2));
        return EXIT_OK;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (StartSmartApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("startsmart.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(StartSmartApplication.class);
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                LOG.warn("failed to initialize log4j routing: {}", e.getMessage());
            }
        }
    }

    private static String required(CommandLine cmd, String name) {
        String value = cmd.getOptionValue(name);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return value.trim();
    }

    private static int parseInt(String raw, String name) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: " + raw, e);
        }
    }

    private static double parseDouble(String raw, String name) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number: " + raw, e);
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        OptionGroup commands = new OptionGroup();
        commands.addOption(Option.builder().longOpt("rank").desc("rank the grids of a region for one category").build());
        commands.addOption(Option.builder().longOpt("evaluate").desc("score every category at one coordinate").build());
        commands.addOption(Option.builder().longOpt("explain").desc("show the evidence behind one grid").build());
        options.addOptionGroup(commands);
        options.addOption(Option.builder().longOpt("region").hasArg().argName("name").desc("region to sweep").build());
        options.addOption(Option.builder().longOpt("category").hasArg().argName("name").desc("business category, e.g. gym or cafe").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("number of grids to return (default 10)").build());
        options.addOption(Option.builder().longOpt("mode").hasArg().argName("fast|full").desc("processing mode (default fast)").build());
        options.addOption(Option.builder().longOpt("lat").hasArg().argName("deg").desc("latitude for --evaluate").build());
        options.addOption(Option.builder().longOpt("lon").hasArg().argName("deg").desc("longitude for --evaluate").build());
        options.addOption(Option.builder().longOpt("radius").hasArg().argName("m").desc("search radius in metres (default bev.radius_m)").build());
        options.addOption(Option.builder().longOpt("grid").hasArg().argName("id").desc("grid id for --explain").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
