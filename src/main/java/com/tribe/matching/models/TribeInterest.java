package com.tribe.matching.models;

import com.tribe.matching.dto.InterestKey;
import com.tribe.matching.dto.enums.InterestCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TribeInterest {
    private InterestCategory category;
    private String name;
    private boolean primary;

    public InterestKey key() {
        return new InterestKey(category, name);
    }
}
