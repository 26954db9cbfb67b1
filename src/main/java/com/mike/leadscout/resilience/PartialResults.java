package com.mike.leadscout.resilience;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class PartialResults<T> {
    @Singular("item")
    List<T> data;
    int totalSources;
    int successfulSources;
    @Singular
    List<String> failedSources;
    boolean partialFailure;
    @Singular
    Map<String, String> errors;

    public static <T> PartialResults<T> empty() {
        return PartialResults.<T>builder().build();
    }
}
