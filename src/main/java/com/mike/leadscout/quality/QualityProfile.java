package com.mike.leadscout.quality;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class QualityProfile {
    double nameScore;
    double phoneScore;
    double addressScore;
    double websiteScore;
    double emailScore;
    @Builder.Default
    List<String> flags = List.of();
    int sourceCount;
    double crossRefScore;
    double overallScore;

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }
}
