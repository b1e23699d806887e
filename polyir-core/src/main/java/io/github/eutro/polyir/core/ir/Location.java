package io.github.eutro.polyir.core.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A source location that IR objects and diagnostics are tagged with.
 */
public final class Location {
    public static final Location UNKNOWN = new Location(null, null, 0, 0);

    private final @Nullable String name;
    private final @Nullable String file;
    private final int line;
    private final int column;

    private Location(@Nullable String name, @Nullable String file, int line, int column) {
        this.name = name;
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public static Location fileLineCol(@NotNull String file, int line, int column) {
        return new Location(null, file, line, column);
    }

    public static Location named(@NotNull String name) {
        return new Location(name, null, 0, 0);
    }

    public boolean isUnknown() {
        return name == null && file == null;
    }

    public @Nullable String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public @Nullable String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location that = (Location) o;
        return line == that.line
                && column == that.column
                && Objects.equals(name, that.name)
                && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, file, line, column);
    }

    @Override
    public String toString() {
        if (name != null) return "\"" + name + "\"";
        if (file != null) return file + ":" + line + ":" + column;
        return "loc(unknown)";
    }
}
