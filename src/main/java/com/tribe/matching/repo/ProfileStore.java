package com.tribe.matching.repo;

import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of profiles and tribes owned by the persistence layer.
 */
public interface ProfileStore {

    Optional<Profile> loadProfile(String userId);

    Optional<Tribe> loadTribe(String tribeId);

    /**
     * Tribes with at least one free seat, optionally limited to a region. A null region
     * means every region.
     */
    List<Tribe> loadTribesWithCapacity(String region);

    /**
     * Profiles of the members currently holding a seat in the tribe. Members without a
     * stored profile are skipped.
     */
    List<Profile> loadMemberProfiles(String tribeId);
}
