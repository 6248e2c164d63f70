package com.tribe.matching.service;

import com.tribe.matching.dto.FactorWeights;
import com.tribe.matching.dto.TribeCompatibility;
import com.tribe.matching.dto.UserCompatibility;
import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;
import com.tribe.matching.utils.basic.Constant;

import java.util.List;
import java.util.Map;

public interface CompatibilityService {

    /**
     * Pair score over personality, interests, communication and location, blended with an
     * advisory score when one is available.
     */
    UserCompatibility userCompatibility(Profile user, Profile target, FactorWeights weights, boolean includeDetails);

    /**
     * Same as {@link #userCompatibility} without the advisory blend. Reproducible for equal inputs.
     */
    UserCompatibility algorithmicUserCompatibility(Profile user, Profile target, FactorWeights weights, boolean includeDetails);

    TribeCompatibility tribeCompatibility(Profile user, Tribe tribe, List<Profile> memberProfiles,
                                          FactorWeights weights, boolean includeDetails);

    /**
     * Scores the user against every candidate concurrently. Results keep candidate order.
     */
    List<UserCompatibility> batchUserCompatibility(Profile user, List<Profile> candidates,
                                                   FactorWeights weights, boolean includeDetails);

    List<TribeCompatibility> batchTribeCompatibility(Profile user, List<Tribe> tribes,
                                                     Map<String, List<Profile>> memberProfiles,
                                                     FactorWeights weights, boolean includeDetails);

    /**
     * Candidates scoring at least {@code threshold}, best first, ties in pool order, at most {@code limit}.
     */
    List<UserCompatibility> findMostCompatibleUsers(Profile user, List<Profile> pool, FactorWeights weights,
                                                    int limit, double threshold, boolean includeDetails);

    default List<UserCompatibility> findMostCompatibleUsers(Profile user, List<Profile> pool, FactorWeights weights) {
        return findMostCompatibleUsers(user, pool, weights,
                Constant.DEFAULT_RESULT_LIMIT, Constant.DEFAULT_SCORE_THRESHOLD, false);
    }

    List<TribeCompatibility> findMostCompatibleTribes(Profile user, List<Tribe> tribes,
                                                      Map<String, List<Profile>> memberProfiles,
                                                      FactorWeights weights, int limit, double threshold,
                                                      boolean includeDetails);

    default List<TribeCompatibility> findMostCompatibleTribes(Profile user, List<Tribe> tribes,
                                                              Map<String, List<Profile>> memberProfiles,
                                                              FactorWeights weights) {
        return findMostCompatibleTribes(user, tribes, memberProfiles, weights,
                Constant.DEFAULT_RESULT_LIMIT, Constant.DEFAULT_SCORE_THRESHOLD, false);
    }
}
