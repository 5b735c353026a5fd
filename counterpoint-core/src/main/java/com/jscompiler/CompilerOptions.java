package com.jscompiler;

import com.jscompiler.util.EnvVars;

import java.util.Map;

/**
 * Settings shared by every compiler pass.
 *
 * @param templateVersion    version written into generated mapping templates
 * @param region             region of the workflow service endpoint
 * @param maxStateNameLength derived state names are truncated to this length
 */
public record CompilerOptions(String templateVersion, String region, int maxStateNameLength) {

    public static final String ENV_TEMPLATE_VERSION = "COUNTERPOINT_TEMPLATE_VERSION";
    public static final String ENV_REGION = "COUNTERPOINT_REGION";
    public static final String ENV_MAX_STATE_NAME_LENGTH = "COUNTERPOINT_MAX_STATE_NAME_LENGTH";

    public CompilerOptions {
        if (templateVersion == null || templateVersion.isBlank()) {
            throw new IllegalArgumentException("templateVersion must not be blank");
        }
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region must not be blank");
        }
        if (maxStateNameLength < CompilerDefaults.MIN_STATE_NAME_LENGTH) {
            throw new IllegalArgumentException("maxStateNameLength must be at least " + CompilerDefaults.MIN_STATE_NAME_LENGTH);
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(CompilerDefaults.TEMPLATE_VERSION, CompilerDefaults.REGION,
            CompilerDefaults.MAX_STATE_NAME_LENGTH);
    }

    public static CompilerOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads overrides from {@code env}; blank values fall back to the defaults and the
     * state name length is clamped to what the orchestrator accepts.
     */
    public static CompilerOptions fromEnvironment(Map<String, String> env) {
        return new CompilerOptions(
            EnvVars.getOrDefault(env, ENV_TEMPLATE_VERSION, CompilerDefaults.TEMPLATE_VERSION),
            EnvVars.getOrDefault(env, ENV_REGION, CompilerDefaults.REGION),
            EnvVars.getIntClamped(env, ENV_MAX_STATE_NAME_LENGTH, CompilerDefaults.MAX_STATE_NAME_LENGTH,
                CompilerDefaults.MIN_STATE_NAME_LENGTH, CompilerDefaults.MAX_STATE_NAME_LENGTH));
    }
}
