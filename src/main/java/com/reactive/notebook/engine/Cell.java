package com.reactive.notebook.engine;

import java.util.LinkedHashSet;
import java.util.Set;

import com.reactive.notebook.analysis.CellSymbols;
import com.reactive.notebook.api.CellStatus;
import com.reactive.notebook.api.RichOutput;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * One notebook cell as seen by the engine. Instances handed out by
 * {@link ReactiveEngine} are copies; only the engine mutates its own.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public final class Cell {
    private final String id;
    private String source = "";
    private CellSymbols symbols = CellSymbols.EMPTY;
    /** Rendered parse failure, or {@code null} when the source analyses cleanly. */
    private String analysisError;
    private CellStatus status = CellStatus.IDLE;
    private String output = "";
    private RichOutput richOutput;
    private String error;

    // Symbols this cell stopped defining whose removal from the namespace is still pending.
    @Getter(AccessLevel.PACKAGE)
    @Setter(AccessLevel.NONE)
    private final Set<String> retired = new LinkedHashSet<>();

    Cell(String id) {
        this.id = id;
    }

    void clearResult(CellStatus newStatus) {
        status = newStatus;
        output = "";
        richOutput = null;
        error = null;
    }

    Cell copy() {
        Cell c = new Cell(id);
        c.source = source;
        c.symbols = symbols;
        c.analysisError = analysisError;
        c.status = status;
        c.output = output;
        c.richOutput = richOutput == null ? null : richOutput.copy();
        c.error = error;
        c.retired.addAll(retired);
        return c;
    }
}
