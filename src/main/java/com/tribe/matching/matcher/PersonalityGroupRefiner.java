package com.tribe.matching.matcher;

import com.tribe.matching.dto.FormationOptions;
import com.tribe.matching.models.Profile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Refines each proximity region on its own. Oversized regions are split into
 * personality-compatible subgroups, undersized subgroups merge where every cross pair
 * clears the threshold, and whatever is still undersized is then packed by size alone.
 * A region yields at most one group below the minimum size and no user is ever dropped.
 * Members of one region are pairwise within {@code maxDistance}, so none of these steps
 * can break the distance limit.
 */
@Slf4j
@Component
public class PersonalityGroupRefiner {

    public List<List<Profile>> refine(List<List<Profile>> proximityGroups,
                                      PairwiseCompatibilityMatrix matrix,
                                      FormationOptions options) {
        List<List<Profile>> result = new ArrayList<>();
        for (List<Profile> region : proximityGroups) {
            result.addAll(refineRegion(region, matrix, options));
        }
        log.debug("Refined {} proximity groups into {} groups", proximityGroups.size(), result.size());
        return result;
    }

    private List<List<Profile>> refineRegion(List<Profile> region, PairwiseCompatibilityMatrix matrix,
                                             FormationOptions options) {
        int min = options.getMinGroupSize();
        int max = options.getMaxGroupSize();
        double threshold = options.getCompatibilityThreshold();

        List<List<Profile>> groups = new ArrayList<>();
        if (region.size() <= max) {
            groups.add(new ArrayList<>(region));
        } else {
            for (List<Profile> subgroup : split(region, matrix, threshold, max)) {
                if (subgroup.size() >= min || !mergeInto(groups, subgroup, matrix, options)) {
                    groups.add(subgroup);
                }
            }
        }
        return packLeftovers(mergeUndersized(groups, matrix, options), min, max);
    }

    /**
     * Merges pairs of undersized groups when the sum lies within [min, max] and every
     * cross pair is compatible.
     */
    private List<List<Profile>> mergeUndersized(List<List<Profile>> groups, PairwiseCompatibilityMatrix matrix,
                                                FormationOptions options) {
        int min = options.getMinGroupSize();
        int max = options.getMaxGroupSize();
        List<List<Profile>> result = new ArrayList<>();
        LinkedList<List<Profile>> tooSmall = new LinkedList<>();
        for (List<Profile> group : groups) {
            if (group.size() >= min) {
                result.add(group);
            } else {
                tooSmall.add(group);
            }
        }

        while (tooSmall.size() > 1) {
            List<Profile> first = tooSmall.removeFirst();
            List<Profile> partner = null;
            for (List<Profile> candidate : tooSmall) {
                int combined = first.size() + candidate.size();
                if (combined >= min && combined <= max
                        && matrix.allCompatible(first, candidate, options.getCompatibilityThreshold())) {
                    partner = candidate;
                    break;
                }
            }
            if (partner != null) {
                tooSmall.remove(partner);
                List<Profile> merged = new ArrayList<>(first);
                merged.addAll(partner);
                result.add(merged);
            } else {
                result.add(first);
            }
        }
        result.addAll(tooSmall);
        return result;
    }

    /**
     * Pools the members of every undersized group in order and cuts the pool into as many
     * in-range groups as it allows. Members that still do not fit fill existing groups
     * that have room; anything left after that becomes the single remainder group.
     */
    List<List<Profile>> packLeftovers(List<List<Profile>> groups, int min, int max) {
        List<List<Profile>> packed = new ArrayList<>();
        List<Profile> pool = new ArrayList<>();
        for (List<Profile> group : groups) {
            if (group.size() >= min) {
                packed.add(group);
            } else {
                pool.addAll(group);
            }
        }
        if (pool.isEmpty()) {
            return packed;
        }

        int size = pool.size();
        int chunks = (size + max - 1) / max;
        if (chunks * min > size) {
            chunks = size / min;
        }
        int placed = Math.min(size, chunks * max);
        int next = 0;
        for (int i = 0; i < chunks; i++) {
            int chunkSize = placed / chunks + (i < placed % chunks ? 1 : 0);
            packed.add(new ArrayList<>(pool.subList(next, next + chunkSize)));
            next += chunkSize;
        }

        List<Profile> remainder = new ArrayList<>(pool.subList(next, size));
        for (List<Profile> group : packed) {
            while (!remainder.isEmpty() && group.size() < max) {
                group.add(remainder.remove(0));
            }
        }
        if (!remainder.isEmpty()) {
            packed.add(remainder);
        }
        return packed;
    }

    /**
     * Seed-and-grow: the first remaining user seeds a subgroup, then remaining users are
     * scanned from the back and pulled in while compatible with every subgroup member.
     */
    List<List<Profile>> split(List<Profile> group, PairwiseCompatibilityMatrix matrix, double threshold, int max) {
        List<List<Profile>> subgroups = new ArrayList<>();
        List<Profile> remaining = new ArrayList<>(group);
        while (!remaining.isEmpty()) {
            List<Profile> subgroup = new ArrayList<>();
            subgroup.add(remaining.remove(0));
            for (int i = remaining.size() - 1; i >= 0 && subgroup.size() < max; i--) {
                Profile candidate = remaining.get(i);
                if (matrix.compatibleWithAll(candidate, subgroup, threshold)) {
                    subgroup.add(candidate);
                    remaining.remove(i);
                }
            }
            subgroups.add(subgroup);
        }
        return subgroups;
    }

    private boolean mergeInto(List<List<Profile>> groups, List<Profile> subgroup,
                              PairwiseCompatibilityMatrix matrix, FormationOptions options) {
        for (List<Profile> group : groups) {
            if (group.size() + subgroup.size() <= options.getMaxGroupSize()
                    && matrix.allCompatible(subgroup, group, options.getCompatibilityThreshold())) {
                group.addAll(subgroup);
                return true;
            }
        }
        return false;
    }
}
