package com.claimrules.domain.extraction.service;

import com.claimrules.domain.extraction.model.ReasoningPrompt;
import com.claimrules.domain.extraction.model.ReasoningResponse;

/**
 * Boundary to the external natural-language reasoning capability.
 * Implementations throw an unchecked exception when the call fails; callers own retries.
 */
public interface ReasoningClient {

    ReasoningResponse analyze(ReasoningPrompt prompt);
}
