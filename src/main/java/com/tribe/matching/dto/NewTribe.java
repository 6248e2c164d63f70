package com.tribe.matching.dto;

import java.util.List;

/**
 * Candidate tribe produced by clustering. {@code undersized} marks the remainder of a
 * proximity region that could not reach the minimum group size.
 */
public record NewTribe(List<MemberScore> members, double averageCompatibility, boolean undersized) {

    public List<String> memberIds() {
        return members.stream().map(MemberScore::userId).toList();
    }

    public int size() {
        return members.size();
    }
}
