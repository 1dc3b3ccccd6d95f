package net.seanstash.application.ai;

/**
 * Port to the hosted language model used for command analysis.
 */
public interface TextGenerationProvider {

    /**
     * Sends one prompt and returns the complete reply.
     *
     * @throws AnalysisProviderException when no usable reply was received
     */
    GenerationResponse generate(GenerationRequest request);

    /**
     * Whether credentials are available for the next call.
     */
    boolean isConfigured();
}
