package com.tribe.matching.repo;

import com.tribe.matching.models.Profile;
import com.tribe.matching.models.Tribe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Map-backed store used when no persistent store is wired in. Iteration order follows
 * insertion so tribe lists are stable between calls.
 */
@Slf4j
@Repository
public class InMemoryProfileStore implements ProfileStore {
    private final Map<String, Profile> profiles = new ConcurrentHashMap<>();
    private final Map<String, Tribe> tribes = new ConcurrentHashMap<>();
    private final List<String> tribeOrder = new CopyOnWriteArrayList<>();

    public void saveProfile(Profile profile) {
        profiles.put(profile.getId(), profile);
    }

    public void saveProfiles(Collection<Profile> batch) {
        batch.forEach(this::saveProfile);
    }

    public void saveTribe(Tribe tribe) {
        if (tribes.put(tribe.getId(), tribe) == null) {
            tribeOrder.add(tribe.getId());
        }
    }

    @Override
    public Optional<Profile> loadProfile(String userId) {
        return Optional.ofNullable(userId).map(profiles::get);
    }

    @Override
    public Optional<Tribe> loadTribe(String tribeId) {
        return Optional.ofNullable(tribeId).map(tribes::get);
    }

    @Override
    public List<Tribe> loadTribesWithCapacity(String region) {
        List<Tribe> result = new ArrayList<>();
        for (String id : tribeOrder) {
            Tribe tribe = tribes.get(id);
            if (tribe != null && tribe.hasCapacity() && (region == null || Objects.equals(region, tribe.getRegion()))) {
                result.add(tribe);
            }
        }
        return result;
    }

    @Override
    public List<Profile> loadMemberProfiles(String tribeId) {
        Tribe tribe = tribes.get(tribeId);
        if (tribe == null) {
            return List.of();
        }
        List<Profile> members = new ArrayList<>();
        for (String userId : tribe.seatedMemberIds()) {
            Profile profile = profiles.get(userId);
            if (profile == null) {
                log.debug("No profile stored for member userId={} of tribeId={}", userId, tribeId);
                continue;
            }
            members.add(profile);
        }
        return members;
    }
}
