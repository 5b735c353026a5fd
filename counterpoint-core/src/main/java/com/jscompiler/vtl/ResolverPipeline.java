package com.jscompiler.vtl;

import java.util.List;

/**
 * A compiled resolver.
 *
 * @param requestTemplate  the resolver's own request template
 * @param responseTemplate the resolver's own response template
 * @param dataSource       the data source of a unit resolver (no stages), otherwise null
 * @param stages           pipeline functions in execution order
 * @param templates        every template in the order the service evaluates them
 */
public record ResolverPipeline(
    String requestTemplate,
    String responseTemplate,
    DataSource dataSource,
    List<PipelineStage> stages,
    List<String> templates
) {

    public ResolverPipeline {
        stages = List.copyOf(stages);
        templates = List.copyOf(templates);
    }

    public boolean isPipeline() {
        return !stages.isEmpty();
    }
}
