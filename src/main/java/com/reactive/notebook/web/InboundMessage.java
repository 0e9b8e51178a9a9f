package com.reactive.notebook.web;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * A client command. Which fields are set depends on {@code type}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class InboundMessage {
    private String type;
    @JsonProperty("cell_id")
    private String cellId;
    @JsonAlias("source")
    private String code;
    private Integer position;
}
