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
public class Interest {
    public static final int PRIMARY_LEVEL = 3;

    private InterestCategory category;
    private String name;
    private int level;

    public boolean isPrimary() {
        return level >= PRIMARY_LEVEL;
    }

    public InterestKey key() {
        return new InterestKey(category, name);
    }
}
