package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CustomOrder {
    private String orderId;
    private int startDay;              // day the order was admitted
    private CustomStation station;
    private int daysAtStation;         // dwell counter, reset on every move
    private int daysInProduction;      // days since leaving WAITING

    public CustomOrder copy() {
        return toBuilder().build();
    }
}
