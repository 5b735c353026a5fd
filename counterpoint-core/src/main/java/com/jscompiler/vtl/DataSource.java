package com.jscompiler.vtl;

import com.jscompiler.service.Service;

/**
 * A backend binding pipeline stages run against.
 *
 * @param name     unique within its namespace
 * @param kind     how requests reach the backend
 * @param service  the bound service, null for the {@code None} data source
 * @param endpoint the HTTP endpoint for {@link DataSourceKind#HTTP}, otherwise null
 */
public record DataSource(String name, DataSourceKind kind, Service service, String endpoint) {

    public static DataSource none() {
        return new DataSource("None", DataSourceKind.NONE, null, null);
    }

    /**
     * Registers a pipeline function against this data source.
     */
    public PipelineStage createFunction(String functionName, String requestTemplate, String responseTemplate) {
        return new PipelineStage(functionName, requestTemplate, responseTemplate, this);
    }
}
