package com.tribe.matching.service;

import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.dto.FormationResult;
import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;

import java.util.List;
import java.util.Map;

public interface TribeFormationService {

    /**
     * Places users into existing tribes with free seats where the fit clears the threshold,
     * forms new tribes from everyone else and improves existing placements by swapping.
     * Inputs are not modified.
     *
     * @param memberProfiles current member profiles keyed by tribe id; missing tribes count as empty
     */
    FormationResult formTribes(List<Profile> users, List<Tribe> existingTribes,
                               Map<String, List<Profile>> memberProfiles, FormationOptions options);
}
