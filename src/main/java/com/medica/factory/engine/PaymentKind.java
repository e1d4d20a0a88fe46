package com.medica.factory.engine;

import com.medica.factory.domain.FactoryConstants;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a payment is made. Decides the commission on any automatic loan it triggers.
 */
@Getter
@RequiredArgsConstructor
public enum PaymentKind {
    WAGE(FactoryConstants.SALARY_LOAN_COMMISSION),
    PLANNED(FactoryConstants.PLANNED_LOAN_COMMISSION);

    private final double loanCommission;
}
