package com.reactive.notebook.io;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reactive.notebook.api.CellStatus;
import com.reactive.notebook.api.RichOutput;
import com.reactive.notebook.engine.Cell;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO form of a persisted notebook: its cells in display order with their
 * last results.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NotebookDocument {
    private List<CellDef> cells = new ArrayList<>();

    /** One persisted cell. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class CellDef {
        private String id;
        private String code = "";
        private String output = "";
        @JsonProperty("rich_output")
        private RichOutput richOutput;
        private String error;
        private CellStatus status = CellStatus.IDLE;

        public CellDef(String id, String code) {
            this.id = id;
            this.code = code;
        }

        /** The persisted form of an engine cell. */
        public static CellDef of(Cell cell) {
            CellDef def = new CellDef(cell.getId(), cell.getSource());
            def.setOutput(cell.getOutput());
            def.setRichOutput(cell.getRichOutput());
            def.setError(cell.getError());
            def.setStatus(cell.getStatus());
            return def;
        }
    }
}
