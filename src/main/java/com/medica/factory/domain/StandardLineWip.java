package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Standard line pipeline. Units flow preStation1 -> station1 (MCE) -> station2 (WMA)
 * -> station3 (PUC) -> arcpQueue -> finished goods.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StandardLineWip {
    @Builder.Default
    private List<WipBatch> preStation1 = new ArrayList<>();
    @Builder.Default
    private List<WipBatch> station1 = new ArrayList<>();
    @Builder.Default
    private List<WipBatch> station2 = new ArrayList<>();
    @Builder.Default
    private List<WipBatch> station3 = new ArrayList<>();
    @Builder.Default
    private List<WipBatch> arcpQueue = new ArrayList<>();

    public int totalUnits() {
        return units(preStation1) + units(station1) + units(station2) + units(station3) + units(arcpQueue);
    }

    public static int units(List<WipBatch> stage) {
        int total = 0;
        for (WipBatch batch : stage) {
            total += batch.getUnits();
        }
        return total;
    }

    public StandardLineWip copy() {
        return StandardLineWip.builder()
                .preStation1(copyOf(preStation1))
                .station1(copyOf(station1))
                .station2(copyOf(station2))
                .station3(copyOf(station3))
                .arcpQueue(copyOf(arcpQueue))
                .build();
    }

    private static List<WipBatch> copyOf(List<WipBatch> stage) {
        return stage.stream().map(WipBatch::copy).collect(Collectors.toCollection(ArrayList::new));
    }
}
