package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Headcount on the ARCP station. Every rookie on staff is in training,
 * so the rookie count is the size of the training list.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Workforce {
    private int experts;
    @Builder.Default
    private List<RookieInTraining> rookiesInTraining = new ArrayList<>();
    private int consecutiveOvertimeDays;

    public int getRookies() {
        return rookiesInTraining.size();
    }

    public int headcount() {
        return experts + getRookies();
    }

    public Workforce copy() {
        return toBuilder()
                .rookiesInTraining(rookiesInTraining.stream()
                        .map(RookieInTraining::copy)
                        .collect(Collectors.toCollection(ArrayList::new)))
                .build();
    }
}
