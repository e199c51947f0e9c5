package pyminimizer.cli;

import java.nio.file.Path;

/**
 * What happened to one file of a batch.
 *
 * @param target where the result was written, null when it was printed
 * @param text the minimized source when it is to be printed, otherwise null
 */
record FileOutcome(Path source, Path target, Status status, String text, String error) {

    enum Status {
        MINIMIZED,
        COPIED,
        FAILED;
    }

    static FileOutcome minimized(Path source, Path target, String text) {
        return new FileOutcome(source, target, Status.MINIMIZED, text, null);
    }

    static FileOutcome copied(Path source, Path target) {
        return new FileOutcome(source, target, Status.COPIED, null, null);
    }

    static FileOutcome failed(Path source, String error) {
        return new FileOutcome(source, null, Status.FAILED, null, error);
    }

    boolean isFailure() {
        return status == Status.FAILED;
    }
}
