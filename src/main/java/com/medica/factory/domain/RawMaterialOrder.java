package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RawMaterialOrder {
    private int orderDay;
    private int quantity;
    private int arrivalDay;
    private double cost;

    public RawMaterialOrder copy() {
        return toBuilder().build();
    }
}
