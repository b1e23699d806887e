package io.github.eutro.polyir.core.diag;

import io.github.eutro.polyir.core.ir.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes diagnostics to registered handlers.
 * <p>
 * Handlers are tried most-recently-registered first, until one reports that it
 * handled the diagnostic. Unhandled diagnostics are logged.
 */
public final class DiagnosticEngine {
    private static final Logger LOGGER = Logger.getLogger(DiagnosticEngine.class.getName());

    /**
     * A diagnostic handler.
     */
    public interface Handler {
        /**
         * Handle a diagnostic.
         *
         * @param diagnostic The diagnostic.
         * @return Whether it was handled, if not it is passed to the next handler.
         */
        boolean handle(Diagnostic diagnostic);
    }

    /**
     * A registration of a handler, which unregisters it when closed.
     */
    public final class Registration implements AutoCloseable {
        private final Handler handler;

        private Registration(Handler handler) {
            this.handler = handler;
        }

        @Override
        public void close() {
            handlers.remove(handler);
        }
    }

    private final List<Handler> handlers = new ArrayList<>();

    public Registration registerHandler(Handler handler) {
        handlers.add(handler);
        return new Registration(handler);
    }

    /**
     * Register a handler that collects every diagnostic into a list.
     *
     * @param sink The list.
     * @return The registration.
     */
    public Registration collectInto(List<Diagnostic> sink) {
        return registerHandler(sink::add);
    }

    public void emit(Diagnostic diagnostic) {
        for (int i = handlers.size() - 1; i >= 0; i--) {
            if (handlers.get(i).handle(diagnostic)) return;
        }
        LOGGER.log(levelOf(diagnostic.getSeverity()), diagnostic::toString);
    }

    /**
     * Create and emit a diagnostic.
     *
     * @param severity The severity.
     * @param location The location.
     * @param message  The message.
     * @return The emitted diagnostic.
     */
    public Diagnostic emit(Diagnostic.Severity severity, Location location, String message) {
        Diagnostic diagnostic = new Diagnostic(severity, location, message);
        emit(diagnostic);
        return diagnostic;
    }

    private static Level levelOf(Diagnostic.Severity severity) {
        switch (severity) {
            case ERROR:
                return Level.SEVERE;
            case WARNING:
                return Level.WARNING;
            default:
                return Level.INFO;
        }
    }
}
