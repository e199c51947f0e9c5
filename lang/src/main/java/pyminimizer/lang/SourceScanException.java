package pyminimizer.lang;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * The source text could not be tokenized.
 */
public class SourceScanException extends MinimizerException {
    @Getter
    private final List<Scanner.Message> messages;

    SourceScanException(List<Scanner.Message> messages) {
        super(messages.stream().map(Scanner.Message::toString).collect(Collectors.joining("; ")));
        this.messages = List.copyOf(messages);
    }
}
