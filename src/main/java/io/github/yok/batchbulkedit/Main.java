package io.github.yok.batchbulkedit;

import io.github.yok.batchbulkedit.core.ExcelExporter;
import io.github.yok.batchbulkedit.core.ExcelImporter;
import io.github.yok.batchbulkedit.core.ImportResult;
import io.github.yok.batchbulkedit.core.XmlWriter;
import io.github.yok.batchbulkedit.model.RecipeEditException;
import io.github.yok.batchbulkedit.model.RecipeTree;
import io.github.yok.batchbulkedit.parser.RecipeParser;
import io.github.yok.batchbulkedit.util.ErrorHandler;
import io.github.yok.batchbulkedit.util.StepRunner;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.Banner;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command line (see {@link CommandLineOptions}) and runs one of two commands:
 * </p>
 * <ul>
 * <li>{@code xml2excel}: parse the recipe (and the documents its steps reference) with
 * {@link RecipeParser} and export it with {@link ExcelExporter}.</li>
 * <li>{@code excel2xml}: parse the recipe, apply the edited workbook with {@link ExcelImporter} and
 * write the updated documents with {@link XmlWriter}.</li>
 * </ul>
 *
 * <p>
 * Failures are reported through {@link ErrorHandler}: recipe rule violations as
 * {@code Validation error: ...}, anything else as {@code Unexpected error: ...}. Either way the
 * process ends with exit code 1.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see CommandLineOptions
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final RecipeParser recipeParser;
    private final ExcelExporter excelExporter;
    private final ExcelImporter excelImporter;
    private final XmlWriter xmlWriter;

    @Getter
    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(createApplication(args).run(args)));
    }

    static SpringApplication createApplication(String... args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.setBannerMode(Banner.Mode.OFF);
        app.setDefaultProperties(CommandLineOptions.defaultProperties(args));
        return app;
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            fail(e.getMessage() + System.lineSeparator() + CommandLineOptions.USAGE);
            return;
        }
        if (options.isHelp()) {
            System.out.println(CommandLineOptions.USAGE);
            return;
        }
        if (options.isVersion()) {
            System.out.println("batch-bulk-edit " + version());
            return;
        }

        // Input files are checked before any step runs
        if (!Files.isRegularFile(options.getXml())) {
            fail("XML file not found: " + options.getXml());
            return;
        }
        if (options.getCommand() == CommandLineOptions.Command.EXCEL2XML
                && !Files.isRegularFile(options.getExcel())) {
            fail("Excel file not found: " + options.getExcel());
            return;
        }

        boolean progress = options.getProgress() != null ? options.getProgress()
                : StepRunner.defaultProgress();
        log.info("Command: {}, xml={}, excel={}", options.getCommand().getLabel(),
                options.getXml(), options.getExcel());
        try {
            if (options.getCommand() == CommandLineOptions.Command.XML2EXCEL) {
                xml2excel(options, new StepRunner(progress, 2, System.out), System.out);
            } else {
                excel2xml(options, new StepRunner(progress, 3, System.out), System.out);
            }
        } catch (RecipeEditException e) {
            exitCode = 1;
            ErrorHandler.errorAndExit("Validation error: " + e.getMessage(), e);
        } catch (Exception e) {
            exitCode = 1;
            log.error("Fatal error occurred (command={}): {}", options.getCommand().getLabel(),
                    e.getMessage(), e);
            ErrorHandler.errorAndExit("Unexpected error: " + e.getMessage(), e);
        }
    }

    void xml2excel(CommandLineOptions options, StepRunner steps, PrintStream out)
            throws Exception {
        List<RecipeTree> trees =
                steps.run("Parsing XML", () -> recipeParser.parse(options.getXml()));
        steps.run("Exporting to Excel", () -> {
            excelExporter.export(trees, options.getExcel());
            return null;
        });
        out.println("Excel written to: " + options.getExcel());
    }

    void excel2xml(CommandLineOptions options, StepRunner steps, PrintStream out)
            throws Exception {
        List<RecipeTree> trees =
                steps.run("Parsing XML", () -> recipeParser.parse(options.getXml()));
        ImportResult result = steps.run("Importing changes",
                () -> excelImporter.importChanges(options.getExcel(), trees));
        Path outDir = steps.run("Writing XML", () -> xmlWriter.write(trees, options.getOut()));
        out.println("Import summary: " + result.summary());
        out.println("XML written to: " + outDir);
    }

    private void fail(String message) {
        exitCode = 1;
        ErrorHandler.errorAndExit(message);
    }

    static String version() {
        return StringUtils.defaultIfBlank(Main.class.getPackage().getImplementationVersion(),
                "unknown");
    }
}
