package pyminimizer.cli;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import pyminimizer.lang.InvalidOptionException;
import pyminimizer.lang.MinimizerOptions;

@Command(
    name = "pyminimizer",
    mixinStandardHelpOptions = true,
    version = "pyminimizer 1.0.0",
    description = "Minimizes Python code using a lexical scanner.",
    footer = "By default the minimizer removes blank lines, comments, docstrings and extraneous whitespace. "
        + "Where needed it inserts a space for whitespace between tokens and uses a tab for indentation. "
        + "Option defaults can be set in ~/.pyminimizer.properties.",
    defaultValueProvider = CommandLine.PropertiesDefaultProvider.class)
public class MinimizerCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MinimizerCommand.class);

    static final int EXIT_FILES_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;
    static final int EXIT_IO_ERROR = 3;
    static final int EXIT_INTERRUPTED = 4;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "IN_PATH", description = "The file to minimize, or the directory with --recursive")
    private Path inPath;

    @Option(names = {"-o", "--out-path"}, paramLabel = "OUT_PATH",
        description = "Write to this path instead of stdout")
    private Path outPath;

    @Option(names = {"-b", "--keep-blank-lines"}, description = "Do not remove blank lines")
    private boolean keepBlankLines;

    @Option(names = {"-c", "--keep-comments"}, description = "Do not remove comment lines and inline comments")
    private boolean keepComments;

    @Option(names = {"-d", "--keep-docstrings"}, description = "Do not remove docstrings")
    private boolean keepDocstrings;

    @Option(names = {"-s", "--keep-whitespace"}, description = "Do not remove extraneous whitespace")
    private boolean keepWhitespace;

    @Option(names = {"-w", "--whitespace-char"}, paramLabel = "CHAR", defaultValue = "\\s",
        converter = EscapedTextConverter.class,
        description = "Whitespace character to use (default: space; \\s, \\t and \\f are understood)")
    private String whitespaceChar;

    @Option(names = {"-i", "--indent-char"}, paramLabel = "CHARS", defaultValue = "\\t",
        converter = EscapedTextConverter.class,
        description = "Indentation to use per level (default: tab; \\s and \\t are understood)")
    private String indentChar;

    @Option(names = {"-r", "--recursive"},
        description = "Treat IN_PATH and --out-path as directories to minimize recursively")
    private boolean recursive;

    @Option(names = {"-j", "--jobs"}, paramLabel = "N", defaultValue = "1",
        description = "Number of files to minimize in parallel with --recursive (default: 1)")
    private int jobs;

    @Option(names = {"-v", "--verbose"},
        description = "Explain what is being done, repeat for debugging output")
    private boolean[] verbose = new boolean[0];

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return commandLine().execute(args);
    }

    static CommandLine commandLine() {
        var cmd = new CommandLine(new MinimizerCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof InvalidOptionException) {
                commandLine.getErr().println("Invalid option: " + ex.getMessage());
                return EXIT_INVALID_OPTIONS;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("ERROR: " + describe((IOException) ex));
                return EXIT_IO_ERROR;
            } else if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                commandLine.getErr().println("Interrupted");
                return EXIT_INTERRUPTED;
            }
            commandLine.getErr().println("Error: " + ex.getMessage());
            ex.printStackTrace(commandLine.getErr());
            return EXIT_FILES_FAILED;
        });
        return cmd;
    }

    private static String describe(IOException ex) {
        if (ex instanceof FileSystemException) {
            var fsex = (FileSystemException) ex;
            var reason = fsex.getReason() != null ? fsex.getReason() : ex.getClass().getSimpleName();
            return reason + ": " + fsex.getFile();
        }
        return ex.toString();
    }

    @Override
    public Integer call() throws IOException, InterruptedException {
        LoggingConfigurator.configure(verbose.length);
        if (jobs < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--jobs must be at least 1, got: " + jobs);
        }

        var options = new MinimizerOptions(keepBlankLines, keepComments, keepDocstrings, keepWhitespace,
            whitespaceChar, indentChar);
        var batch = new BatchMinimizer(options, jobs, spec.commandLine().getOut());

        BatchResult result;
        if (recursive) {
            checkDirectories();
            result = batch.minimizeTree(inPath, outPath);
        } else {
            checkFiles();
            result = batch.minimizeFile(inPath, outPath);
        }

        if (!result.succeeded()) {
            LOGGER.warn("{} of {} files could not be minimized", result.failures().size(), result.outcomes().size());
            return EXIT_FILES_FAILED;
        }
        return 0;
    }

    private void checkDirectories() throws IOException {
        if (!Files.exists(inPath)) {
            throw new NoSuchFileException(inPath.toString(), null, "Given in path does not exist");
        }
        if (!Files.isDirectory(inPath)) {
            throw new NotDirectoryException(inPath.toString());
        }
        if (outPath != null && Files.exists(outPath) && !Files.isDirectory(outPath)) {
            throw new NotDirectoryException(outPath.toString());
        }
    }

    private void checkFiles() throws IOException {
        if (!Files.exists(inPath)) {
            throw new NoSuchFileException(inPath.toString(), null, "Given in path does not exist");
        }
        if (!Files.isRegularFile(inPath)) {
            throw new FileSystemException(inPath.toString(), null, "Given in path is not a file");
        }
        if (outPath != null && Files.exists(outPath) && !Files.isRegularFile(outPath)) {
            throw new FileSystemException(outPath.toString(), null, "Given out path is not a file");
        }
    }
}
