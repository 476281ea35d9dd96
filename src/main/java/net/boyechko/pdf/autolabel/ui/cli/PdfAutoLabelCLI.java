/*
 * PDF-Auto-Label - Automated label numbering for tagged documents
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autolabel.ui.cli;

import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.boyechko.pdf.autolabel.config.LabelConfig;
import net.boyechko.pdf.autolabel.core.LabelingService;
import net.boyechko.pdf.autolabel.core.ProcessingResult;
import net.boyechko.pdf.autolabel.core.VerbosityLevel;
import net.boyechko.pdf.autolabel.pdf.PdfCustodian;
import net.boyechko.pdf.autolabel.ui.ProcessingReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfAutoLabelCLI {
    static final String DEFAULT_OUTPUT_SUFFIX = "_labelled";

    private static final Logger logger = LoggerFactory.getLogger(PdfAutoLabelCLI.class);

    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            Path configPath,
            String password,
            Integer headingLevel,
            boolean dryRun,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (!dryRun && outputPath == null) {
                throw new IllegalArgumentException("Output path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Accumulates parsed arguments and derives the output path. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        Path configPath;
        String password;
        Integer headingLevel;
        boolean dryRun;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (configPath != null && !Files.isRegularFile(configPath)) {
                throw new CLIException("Label configuration not found: " + configPath);
            }
            if (!dryRun) {
                resolveOutputPath();
            }
            return new CLIConfig(
                    inputPath, outputPath, configPath, password, headingLevel, dryRun, verbosity);
        }

        private void resolveOutputPath() throws CLIException {
            String baseName =
                    inputPath
                            .getFileName()
                            .toString()
                            .replaceFirst("(" + DEFAULT_OUTPUT_SUFFIX + ")*[.][^.]+$", "");
            String outputFilename = baseName + DEFAULT_OUTPUT_SUFFIX + ".pdf";
            if (outputPath == null) {
                Path parent = inputPath.getParent();
                outputPath =
                        parent != null ? parent.resolve(outputFilename) : Paths.get(outputFilename);
            } else if (Files.isDirectory(outputPath)) {
                outputPath = outputPath.resolve(outputFilename);
            }
            if (outputPath.toAbsolutePath().equals(inputPath.toAbsolutePath())) {
                throw new CLIException("Output file must differ from the input file");
            }
        }
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Runs the tool and returns the process exit status. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return 0;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger.info(
                    "Starting labelling of {} with verbosity level {}",
                    config.inputPath(),
                    config.verbosity());
            ProcessingResult result = processFile(config, out);
            return result.issues().hasErrors() ? 1 : 0;
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("✗ Failed to process " + e.getMessage());
            logger.debug("Processing failed", e);
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--config=")) {
                b.configPath = Paths.get(args[i].substring("--config=".length()));
            } else if (args[i].startsWith("--heading-level=")) {
                b.headingLevel = parseHeadingLevel(args[i].substring("--heading-level=".length()));
            } else {
                switch (args[i]) {
                    case "-c", "--config" -> {
                        if (i + 1 < args.length) {
                            b.configPath = Paths.get(args[++i]);
                        } else {
                            throw new CLIException("Configuration file not specified after -c");
                        }
                    }
                    case "-p", "--password" -> {
                        if (i + 1 < args.length) {
                            b.password = args[++i];
                        } else {
                            throw new CLIException("Password not specified after -p");
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-n", "--dry-run" -> b.dryRun = true;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple output files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static int parseHeadingLevel(String value) throws CLIException {
        try {
            int level = Integer.parseInt(value);
            if (level < 1 || level > 6) {
                throw new CLIException("Heading level must be between 1 and 6: " + value);
            }
            return level;
        } catch (NumberFormatException e) {
            throw new CLIException("Heading level is not a number: " + value);
        }
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(verbosity.logLevel());
    }

    static LabelConfig loadConfig(CLIConfig config) {
        LabelConfig labels =
                config.configPath() != null
                        ? LabelConfig.fromFile(config.configPath())
                        : LabelConfig.loadDefault();
        if (config.headingLevel() != null) {
            labels = labels.withHeadingLevel(config.headingLevel());
        }
        return labels;
    }

    private static ProcessingResult processFile(CLIConfig config, PrintStream out)
            throws IOException {
        ProcessingReporter reporter = new ProcessingReporter(out, config.verbosity());
        try {
            LabelingService service =
                    new LabelingService.LabelingServiceBuilder()
                            .withPdfCustodian(
                                    new PdfCustodian(config.inputPath(), config.password()))
                            .withListener(reporter)
                            .withConfig(loadConfig(config))
                            .build();

            if (config.dryRun()) {
                logger.info("Computing labels without writing");
                return service.analyze();
            }
            Path outputParent = config.outputPath().toAbsolutePath().getParent();
            if (outputParent != null) {
                Files.createDirectories(outputParent);
            }
            logger.info("Writing labels to {}", config.outputPath());
            return service.label(config.outputPath());
        } finally {
            reporter.close();
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: java PdfAutoLabelCLI [-n] [-q|-v|-vv] [-p password] [--config=<file>] [--heading-level=<n>] <inputpath> [<outputpath>]\n"
                + "  -h, --help           Show this help message\n"
                + "  -n, --dry-run        Compute and report labels without writing a PDF\n"
                + "  -q, --quiet          Only show errors and final status\n"
                + "  -v, --verbose        Show every assigned label and issue\n"
                + "  -vv, --debug         Show all debug information\n"
                + "  -p, --password       Password for encrypted PDFs\n"
                + "  -c, --config=<file>  YAML label configuration (default: built-in templates)\n"
                + "  --heading-level=<n>  Heading level that starts the default heading series\n"
                + "Examples:\n"
                + "  java PdfAutoLabelCLI -n -v document.pdf\n"
                + "  java PdfAutoLabelCLI --config=labels.yaml document.pdf output.pdf";
    }
}
