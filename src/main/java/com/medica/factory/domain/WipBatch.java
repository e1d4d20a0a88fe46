package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WipBatch {
    private int units;
    private int startDay;
    private int daysRemaining; // dwell left at the current stage

    public WipBatch copy() {
        return toBuilder().build();
    }
}
