package io.github.yok.batchbulkedit;

import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Parsed command line of the tool.
 *
 * <p>
 * Usage:
 * </p>
 * <ul>
 * <li>{@code xml2excel --xml <recipe.pxml> --excel <out.xlsx>}</li>
 * <li>{@code excel2xml --xml <recipe.pxml> --excel <edited.xlsx> [--out <dir>]}</li>
 * <li>global flags: {@code --debug}, {@code --progress} / {@code --no-progress},
 * {@code --version}, {@code --help}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class CommandLineOptions {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: batch-bulk-edit <command> [options]", "",
            "Commands:",
            "  xml2excel --xml <recipe> --excel <out.xlsx>        Export a recipe to Excel",
            "  excel2xml --xml <recipe> --excel <edited.xlsx> [--out <dir>]",
            "                                                     Apply an edited workbook",
            "", "Options:",
            "  --debug          Write DEBUG logs to batch_bulk_editor.log",
            "  --progress       Show numbered steps with timings",
            "  --no-progress    Show plain step bullets",
            "  --version        Print the version and exit",
            "  --help           Print this help and exit");

    // Log file written with --debug
    static final String DEBUG_LOG_FILE = "batch_bulk_editor.log";

    /**
     * Subcommands of the tool.
     */
    @Getter
    @AllArgsConstructor
    public enum Command {

        // Recipe XML to workbook.
        XML2EXCEL("xml2excel"),

        // Edited workbook back to recipe XML.
        EXCEL2XML("excel2xml");

        private final String label;

        static Optional<Command> fromLabel(String label) {
            return Arrays.stream(values()).filter(c -> c.label.equals(label)).findFirst();
        }
    }

    private Command command;
    private Path xml;
    private Path excel;
    private Path out;
    private boolean debug;
    // null when neither --progress nor --no-progress was given
    private Boolean progress;
    private boolean version;
    private boolean help;

    private CommandLineOptions() {}

    /**
     * Parses the arguments.
     *
     * @param args command line arguments
     * @return parsed options
     * @throws IllegalArgumentException on an unknown argument, a missing option value or a missing
     *         required option
     */
    public static CommandLineOptions parse(String... args) {
        CommandLineOptions options = new CommandLineOptions();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--xml":
                    options.xml = Paths.get(value(args, ++i, "--xml"));
                    break;
                case "--excel":
                    options.excel = Paths.get(value(args, ++i, "--excel"));
                    break;
                case "--out":
                    options.out = Paths.get(value(args, ++i, "--out"));
                    break;
                case "--debug":
                    options.debug = true;
                    break;
                case "--progress":
                    options.progress = Boolean.TRUE;
                    break;
                case "--no-progress":
                    options.progress = Boolean.FALSE;
                    break;
                case "--version":
                    options.version = true;
                    break;
                case "--help":
                case "-h":
                    options.help = true;
                    break;
                default:
                    Optional<Command> command = Command.fromLabel(args[i]);
                    if (!command.isPresent() || options.command != null) {
                        throw new IllegalArgumentException("Unknown argument: " + args[i]);
                    }
                    options.command = command.get();
            }
        }
        if (!options.help && !options.version) {
            options.validate();
        }
        return options;
    }

    /**
     * Returns the Spring properties implied by the arguments, used as application defaults.
     *
     * <p>
     * {@code --debug} turns on DEBUG logging for this application and writes the log to
     * {@code batch_bulk_editor.log}. Arguments are only scanned for that flag, so this never fails.
     * </p>
     *
     * @param args command line arguments
     * @return default properties
     */
    public static Map<String, Object> defaultProperties(String... args) {
        if (!Arrays.asList(args).contains("--debug")) {
            return ImmutableMap.of();
        }
        return ImmutableMap.of("logging.level.io.github.yok.batchbulkedit", "DEBUG",
                "logging.file.name", DEBUG_LOG_FILE);
    }

    private void validate() {
        if (command == null) {
            throw new IllegalArgumentException("Missing command: xml2excel or excel2xml");
        }
        if (xml == null) {
            throw new IllegalArgumentException("Missing required option: --xml");
        }
        if (excel == null) {
            throw new IllegalArgumentException("Missing required option: --excel");
        }
        if (out != null && command != Command.EXCEL2XML) {
            throw new IllegalArgumentException("--out is only valid for excel2xml");
        }
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }
}
