package com.shomee.spices.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DiagnosticsReport(
    String backend,
    String database,
    @JsonProperty("database_url") String databaseUrl,
    @JsonProperty("database_name") String databaseName,
    @JsonProperty("connection_status") String connectionStatus,
    List<String> collections
) {}
