package com.medica.factory.domain;

public enum PolicyTrigger {
    INITIAL_CALCULATION,
    MACHINE_PURCHASED,
    MACHINE_SOLD,
    EMPLOYEE_HIRED,
    EMPLOYEE_QUIT,
    EMPLOYEE_PROMOTED,
    DEMAND_PHASE_CHANGE,
    MANUAL_RECALC
}
