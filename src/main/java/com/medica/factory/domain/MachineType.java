package com.medica.factory.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Machine-backed stations. Prices are per machine.
 */
@Getter
@RequiredArgsConstructor
public enum MachineType {
    MCE(20000, 10000, 10000),
    WMA(15000, 7500, 7500),
    PUC(12000, 4000, 4000);

    private final double buyPrice;
    private final double sellPrice;
    private final double bookValue; // used for terminal asset valuation
}
