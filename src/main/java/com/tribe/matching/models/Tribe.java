package com.tribe.matching.models;

import com.tribe.matching.dto.enums.TribeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tribe {
    private String id;
    private String name;
    private String region;
    private Coordinates coordinates;
    @Builder.Default
    private List<TribeMembership> members = new ArrayList<>();
    private int maxMembers;
    @Builder.Default
    private List<TribeInterest> interests = new ArrayList<>();
    @Builder.Default
    private TribeStatus status = TribeStatus.ACTIVE;

    public int occupiedSeats() {
        return (int) members.stream()
                .filter(m -> m.getStatus() == null || m.getStatus().occupiesSeat())
                .count();
    }

    public int availableSeats() {
        return Math.max(0, maxMembers - occupiedSeats());
    }

    public boolean hasCapacity() {
        return availableSeats() > 0;
    }

    public List<String> seatedMemberIds() {
        return members.stream()
                .filter(m -> m.getStatus() == null || m.getStatus().occupiesSeat())
                .map(TribeMembership::getUserId)
                .toList();
    }
}
