package com.openforge.memoryengine.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * POST {base-url}/embeddings body.
 *
 * {@code dimensions} is only sent to models that can shorten their output
 * (the text-embedding-3 family); other OpenAI-compatible servers reject it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        String  model,
        String  input,
        String  encodingFormat,
        Integer dimensions
) {

    private static final String SHORTENABLE_MODEL_PREFIX = "text-embedding-3";

    public static EmbeddingRequest forText(String input, String model, int dimensions) {
        Integer requested = model != null && model.startsWith(SHORTENABLE_MODEL_PREFIX) ? dimensions : null;
        return new EmbeddingRequest(model, input, "float", requested);
    }
}
