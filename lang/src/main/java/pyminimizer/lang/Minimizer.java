package pyminimizer.lang;

import java.util.List;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Shrinks Python source by dropping blank lines, comments, docstrings and whitespace the
 * tokenizer does not need. The result re-tokenizes to the same content tokens.
 *
 * <p>Instances hold no per-run state and can be shared between threads.
 */
@RequiredArgsConstructor
public final class Minimizer {

    @Getter
    private final @NonNull MinimizerOptions options;

    private final @NonNull MinimizerEventSink events;

    public Minimizer() {
        this(MinimizerOptions.defaults());
    }

    public Minimizer(MinimizerOptions options) {
        this(options, MinimizerEventSink.NONE);
    }

    public static String minimize(String source, MinimizerOptions options) {
        return new Minimizer(options).minimize(source);
    }

    /**
     * @throws SourceScanException if the source cannot be tokenized
     * @throws MalformedTokenStreamException if brackets or indentation do not nest
     */
    public String minimize(@NonNull String source) {
        var scanner = new Scanner(source);
        var tokens = scanner.getTokens();
        if (scanner.hasErrors()) {
            throw new SourceScanException(scanner.getErrors());
        }
        return minimize(tokens);
    }

    /**
     * Minimizes an already tokenized source. The stream must end with ENDMARKER; tokens after
     * it are ignored.
     */
    public String minimize(@NonNull List<Token> tokens) {
        var groups = new GroupSegmenter(events).segment(tokens);
        groups = DocstringDetector.detect(groups);
        return new OutputAssembler(options, events).assemble(groups);
    }
}
