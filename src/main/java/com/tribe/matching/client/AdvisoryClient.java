package com.tribe.matching.client;

import com.tribe.matching.dto.AdvisoryResult;
import com.tribe.matching.exceptions.AdvisoryUnavailableException;

/**
 * External text-scoring service. Implementations may block; callers bound them with a timeout.
 */
public interface AdvisoryClient {

    /**
     * @throws AdvisoryUnavailableException when the service cannot produce an answer
     */
    AdvisoryResult scoreText(String prompt);

    boolean isEnabled();
}
