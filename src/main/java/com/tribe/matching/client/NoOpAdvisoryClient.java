package com.tribe.matching.client;

import com.tribe.matching.dto.AdvisoryResult;
import com.tribe.matching.exceptions.AdvisoryUnavailableException;

/**
 * Used when no advisory service is configured. Every call fails fast so callers fall
 * back to algorithmic results.
 */
public class NoOpAdvisoryClient implements AdvisoryClient {

    @Override
    public AdvisoryResult scoreText(String prompt) {
        throw new AdvisoryUnavailableException("Advisory service disabled");
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
