package com.plansmith.core.llm;

/**
 * Capability for turning a system instruction and a user instruction into free-form text.
 * <p>
 * Implementations block until the model responds. Transport failures surface as
 * unchecked exceptions and are fatal to the current pipeline run; callers never
 * retry them.
 */
@FunctionalInterface
public interface GenerationProvider {

    /**
     * @param systemInstruction the role and constraints for the model
     * @param userInstruction   the request content
     * @return the model's reply, possibly empty but never {@code null}
     */
    String invoke(String systemInstruction, String userInstruction);
}
