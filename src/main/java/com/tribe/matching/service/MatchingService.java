package com.tribe.matching.service;

import com.tribe.matching.dto.FactorWeights;
import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.dto.MatchingOutcome;
import com.tribe.matching.dto.RankedResult;
import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;

import java.util.List;
import java.util.Map;

/**
 * Id-based entry points used by schedulers and API layers. Unknown reference ids fail the
 * call; unknown candidate ids are reported per item.
 */
public interface MatchingService {

    RankedResult scoreUsers(String userId, List<String> candidateIds, FactorWeights weights, boolean includeDetails);

    RankedResult scoreTribes(String userId, List<String> candidateTribeIds, FactorWeights weights, boolean includeDetails);

    /**
     * @param existingTribes tribes to fill first; null loads every tribe with free seats from the store
     * @param memberProfiles member profiles per tribe; tribes missing from the map are loaded from the store
     */
    MatchingOutcome formTribes(List<String> userIds, List<Tribe> existingTribes,
                               Map<String, List<Profile>> memberProfiles, FormationOptions options);

    MatchingOutcome formTribesInRegion(List<String> userIds, String region, FormationOptions options);

    /**
     * Runs formation over already loaded snapshots without touching the store.
     */
    MatchingOutcome formTribesFromSnapshot(List<Profile> users, List<Tribe> existingTribes,
                                           Map<String, List<Profile>> memberProfiles, FormationOptions options);
}
