package com.medica.factory.domain;

public enum ActionType {
    ORDER_MATERIALS,
    ADJUST_BATCH_SIZE,
    ADJUST_MCE_ALLOCATION,
    HIRE_ROOKIE,
    HIRE_EXPERT,
    TAKE_LOAN,
    PAY_DEBT,
    BUY_MACHINE,
    SELL_MACHINE,
    ADJUST_PRICE,
    SET_REORDER_POINT,
    SET_ORDER_QUANTITY
}
