package pyminimizer.cli;

import java.util.List;
import java.util.stream.Collectors;

record BatchResult(List<FileOutcome> outcomes) {

    BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    List<FileOutcome> failures() {
        return outcomes.stream().filter(FileOutcome::isFailure).collect(Collectors.toList());
    }

    long count(FileOutcome.Status status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }

    boolean succeeded() {
        return failures().isEmpty();
    }
}
