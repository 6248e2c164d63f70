package com.tribe.matching.service;

import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.dto.NewTribe;
import com.tribe.matching.models.Profile;

import java.util.List;

public interface ClusteringService {

    /**
     * Partitions the users into candidate tribes. Every input user appears in exactly one
     * returned tribe; tribes below the minimum size are flagged undersized.
     */
    List<NewTribe> formGroups(List<Profile> users, FormationOptions options);
}
