package adf.cli;

import adf.Adf;
import adf.AdfException;
import adf.Document;
import adf.ParseMode;
import adf.ParseOptions;
import adf.mappers.AdfJson;
import adf.mappers.AdfYaml;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line front end: checks ADF files and converts them to JSON, YAML or normalized ADF.
 */
@Command(
        name = "adf",
        mixinStandardHelpOptions = true,
        version = "adf " + Adf.VERSION,
        description = "Parse, check and convert ADF (Augmentable Data Format) files.",
        subcommands = {
                HelpCommand.class,
                AdfCli.Check.class,
                AdfCli.ToJson.class,
                AdfCli.ToYaml.class,
                AdfCli.Format.class,
        })
public class AdfCli implements Runnable {

    static final int OK = 0;
    static final int ERR = 1;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        CommandLine cl = new CommandLine(new AdfCli());
        cl.setCaseInsensitiveEnumValuesAllowed(true);
        return cl;
    }

    static int execute(PrintWriter out, PrintWriter err, String... args) {
        CommandLine cl = newCommandLine();
        cl.setOut(out);
        cl.setErr(err);
        return cl.execute(args);
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing command");
    }

    static class InputOptions {

        @Parameters(index = "0", paramLabel = "FILE", description = "ADF file to read")
        Path file;

        @Option(names = "--mode", paramLabel = "MODE", description = "strict or lenient (default: ${DEFAULT-VALUE})")
        ParseMode mode = ParseMode.LENIENT;

        @Option(names = "--no-infer", description = "Keep every value as a string")
        boolean noInfer;

        @Option(names = "--verbose", description = "Log section classification to stderr")
        boolean verbose;

        Document load() throws IOException {
            if (verbose) {
                enableFineLogging();
            }
            ParseOptions options = ParseOptions.builder()
                    .mode(mode)
                    .inferTypes(!noInfer)
                    .build();
            return Adf.parseFile(file, options);
        }
    }

    abstract static class FileCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Mixin
        InputOptions input;

        @Override
        public Integer call() {
            PrintWriter err = spec.commandLine().getErr();
            try {
                Document document = input.load();
                write(document, spec.commandLine().getOut());
                return OK;
            } catch (NoSuchFileException ex) {
                err.println("Error: File not found: " + ex.getFile());
            } catch (IOException ex) {
                err.println("Error: Could not read " + input.file + ": " + ex.getMessage());
            } catch (AdfException ex) {
                err.println("Error: " + ex.getMessage());
            }
            err.flush();
            return ERR;
        }

        abstract void write(Document document, PrintWriter out);
    }

    @Command(name = "parse", aliases = "check", description = "Parse and validate an ADF file")
    static class Check extends FileCommand {

        @Override
        void write(Document document, PrintWriter out) {
            out.println("Valid ADF document");
            out.println("  " + document.toStructuredCopy().size() + " keys in root");
            int relative = document.relativeSectionsCopy().size();
            if (relative > 0) {
                out.println("  " + relative + " relative sections");
            }
            out.flush();
        }
    }

    @Command(name = "to-json", description = "Convert an ADF file to JSON")
    static class ToJson extends FileCommand {

        @Option(names = "--relative", description = "Include relative sections")
        boolean relative;

        @Override
        void write(Document document, PrintWriter out) {
            out.println(AdfJson.toJson(document, relative));
            out.flush();
        }
    }

    @Command(name = "to-yaml", description = "Convert an ADF file to YAML")
    static class ToYaml extends FileCommand {

        @Override
        void write(Document document, PrintWriter out) {
            out.print(new AdfYaml().toYaml(document));
            out.flush();
        }
    }

    @Command(name = "format", description = "Print an ADF file in normalized form")
    static class Format extends FileCommand {

        @Override
        void write(Document document, PrintWriter out) {
            out.println(document.serialize());
            out.flush();
        }
    }

    private static void enableFineLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler h : root.getHandlers()) {
            h.setLevel(Level.FINE);
        }
    }
}
