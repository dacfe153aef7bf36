package com.norma.orchestration.llm;

/**
 * Text in, text out. Implementations throw
 * {@link com.norma.orchestration.exception.ServiceUnavailableException} when the provider
 * cannot be reached.
 */
public interface LanguageModelClient {

    String call(LlmRequest request);
}
