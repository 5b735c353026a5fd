package com.jscompiler.service;

/**
 * A backend a compiled function may call. Two services are the same backend when
 * their records are equal.
 */
public sealed interface Service permits KeyValueStore, ComputeFunction, WorkflowOrchestrator {

    /**
     * @return the logical name of the resource, used to derive stage and data-source names
     */
    String name();
}
