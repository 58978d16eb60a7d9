package io.nextrun.core;

/**
 * Turns an instruction into a response. One call per job; may take arbitrarily
 * long and may throw. Side effects such as rescheduling happen through tools.
 */
@FunctionalInterface
public interface ReasoningEngine {

    /**
     * Runs the engine on one input.
     *
     * @param input the instruction for this run
     * @return the engine's final answer
     */
    String invoke(String input);
}
