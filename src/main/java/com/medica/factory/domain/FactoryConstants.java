package com.medica.factory.domain;

/**
 * Calibration constants of the factory model.
 * These describe the plant itself and are not meant to be tuned by optimizers.
 */
public final class FactoryConstants {

    private FactoryConstants() {
    }

    // Simulation horizon
    public static final int SIMULATION_START_DAY = 51;
    public static final int SIMULATION_END_DAY = 415;

    // Workforce (per day)
    public static final double ROOKIE_SALARY = 85;
    public static final double EXPERT_SALARY = 150;
    public static final double OVERTIME_MULTIPLIER = 1.5;
    public static final double HOURS_PER_SHIFT = 8;
    public static final double EXPERT_PRODUCTIVITY = 3.0;     // ARCP units per expert per day
    public static final double ROOKIE_PRODUCTIVITY_FACTOR = 0.4;
    public static final int ROOKIE_TRAINING_DAYS = 15;

    // Finance
    public static final double DAILY_DEBT_INTEREST_RATE = 0.001;
    public static final double DAILY_CASH_INTEREST_RATE = 0.0005;
    public static final double PLANNED_LOAN_COMMISSION = 0.02;
    public static final double SALARY_LOAN_COMMISSION = 0.05;

    // Raw material
    public static final double RAW_MATERIAL_UNIT_COST = 50;
    public static final double RAW_MATERIAL_ORDER_FEE = 1000;
    public static final int RAW_MATERIAL_LEAD_TIME = 4;
    public static final int STANDARD_MATERIAL_PER_UNIT = 2;
    public static final int CUSTOM_MATERIAL_PER_UNIT = 1;

    // Standard line
    public static final double STANDARD_ORDER_FEE = 100;
    public static final int STANDARD_WMA_DWELL_DAYS = 4;
    public static final int STANDARD_PUC_DWELL_DAYS = 1;

    // Machines and custom line
    public static final int MCE_UNITS_PER_MACHINE = 30;
    public static final int CUSTOM_UNITS_PER_MACHINE = 6;       // WMA and PUC, per day
    public static final int CUSTOM_MIN_DWELL_DAYS = 1;
    public static final int MAX_CUSTOM_WIP = 360;
    public static final int LATE_DELIVERY_DAYS = 7;

    /** Days in the standard payroll cycle. */
    public static final int PAYROLL_CYCLE_DAYS = 7;

    public static double rookieProductivity() {
        return EXPERT_PRODUCTIVITY * ROOKIE_PRODUCTIVITY_FACTOR;
    }
}
