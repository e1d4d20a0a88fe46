package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RookieInTraining {
    private int hireDay;
    private int daysRemaining;

    public RookieInTraining copy() {
        return new RookieInTraining(hireDay, daysRemaining);
    }
}
