package com.jscompiler.vtl;

/**
 * One request/response template pair bound to one backend invocation.
 */
public record PipelineStage(String name, String requestTemplate, String responseTemplate, DataSource dataSource) {
}
