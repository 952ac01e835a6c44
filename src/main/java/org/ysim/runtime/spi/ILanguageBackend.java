package org.ysim.runtime.spi;

/**
 * Generative-language backend used by heavy actions.
 * <p>
 * Implementations must be safe for concurrent use: the heavy pool calls them from several
 * threads at once, bounded by its fractional-resource budget.
 */
public interface ILanguageBackend {

    /**
     * Runs one chat completion.
     *
     * @param systemPrompt role and persona instructions
     * @param userPrompt   the task
     * @return the generated text, never {@code null}
     * @throws GatewayException on timeout, transport failure or a malformed response
     */
    String chat(String systemPrompt, String userPrompt) throws GatewayException;
}
