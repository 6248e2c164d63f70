package com.tribe.matching.matcher;

import com.tribe.matching.models.Profile;
import com.tribe.matching.utils.GeoUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * First-fit geographic grouping. Each user joins the first group whose every member is
 * within {@code maxDistanceMiles}, otherwise starts a new group. The result depends on
 * input order: the same users in a different order may group differently.
 */
@Component
public class ProximityGrouper {

    public List<List<Profile>> group(List<Profile> users, double maxDistanceMiles) {
        List<List<Profile>> groups = new ArrayList<>();
        for (Profile user : users) {
            List<Profile> target = null;
            for (List<Profile> group : groups) {
                if (withinDistanceOfAll(user, group, maxDistanceMiles)) {
                    target = group;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                groups.add(target);
            }
            target.add(user);
        }
        return groups;
    }

    public static boolean withinDistanceOfAll(Profile user, List<Profile> group, double maxDistanceMiles) {
        for (Profile member : group) {
            if (!GeoUtils.withinMiles(user.getCoordinates(), member.getCoordinates(), maxDistanceMiles)) {
                return false;
            }
        }
        return true;
    }
}
