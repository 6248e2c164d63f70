package com.tribe.matching.models;

import com.tribe.matching.dto.enums.CommunicationStyle;
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
public class Profile {
    private String id;
    private String name;
    private Coordinates coordinates;
    @Builder.Default
    private List<PersonalityTraitScore> personalityTraits = new ArrayList<>();
    @Builder.Default
    private List<Interest> interests = new ArrayList<>();
    private CommunicationStyle communicationStyle;
    private Double maxTravelDistance;
}
