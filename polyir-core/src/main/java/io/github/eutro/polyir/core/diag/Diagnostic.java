package io.github.eutro.polyir.core.diag;

import io.github.eutro.polyir.core.ir.Location;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A message about the IR, tagged with a location and a severity.
 */
public final class Diagnostic {
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        REMARK("remark"),
        NOTE("note");

        private final String spelling;

        Severity(String spelling) {
            this.spelling = spelling;
        }

        @Override
        public String toString() {
            return spelling;
        }
    }

    private final Severity severity;
    private final Location location;
    private final String message;
    private final List<Diagnostic> notes = new ArrayList<>();

    public Diagnostic(@NotNull Severity severity, @NotNull Location location, @NotNull String message) {
        this.severity = severity;
        this.location = location;
        this.message = message;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Location getLocation() {
        return location;
    }

    public String getMessage() {
        return message;
    }

    public List<Diagnostic> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    /**
     * Attach a note to this diagnostic.
     *
     * @param location The location the note refers to.
     * @param message  The note text.
     * @return This diagnostic.
     */
    public Diagnostic attachNote(Location location, String message) {
        notes.add(new Diagnostic(Severity.NOTE, location, message));
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(location).append(": ").append(severity).append(": ").append(message);
        for (Diagnostic note : notes) {
            sb.append('\n').append(note);
        }
        return sb.toString();
    }
}
