package com.brandinsight.research.client;

/**
 * Text generation provider. Failures surface as ProviderException and are never retried here.
 */
public interface TextGenerationClient {

    String CONNECTOR = "text_generation";

    GenerationResult generate(String systemPrompt, String userPrompt, GenerationOptions options);
}
