package com.jscompiler;

/**
 * Default values for {@link CompilerOptions}.
 */
public final class CompilerDefaults {

    private CompilerDefaults() {
    }

    /** Mapping-template version stamped on every generated request. */
    public static final String TEMPLATE_VERSION = "2018-05-29";

    /** Region used to derive the workflow service endpoint. */
    public static final String REGION = "us-east-1";

    /** The orchestrator rejects state names longer than this. */
    public static final int MAX_STATE_NAME_LENGTH = 80;

    // bounds applied to overrides read from the environment
    public static final int MIN_STATE_NAME_LENGTH = 16;
}
