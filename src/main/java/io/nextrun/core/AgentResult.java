package io.nextrun.core;

/**
 * The result of a tool invocation.
 *
 * @param value the string handed back to the model
 */
public record AgentResult(String value) {

    /**
     * Creates a result with the given value.
     */
    public static AgentResult of(String value) {
        return new AgentResult(value);
    }
}
