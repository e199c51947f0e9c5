package pyminimizer.lang;

/**
 * Receives the engine's {@link MinimizerEvent}s. Called synchronously from the thread running
 * the minimization.
 */
@FunctionalInterface
public interface MinimizerEventSink {

    MinimizerEventSink NONE = event -> { };

    void accept(MinimizerEvent event);
}
