package com.medica.factory.domain;

public enum ConditionType {
    CASH_BELOW,
    CASH_ABOVE,
    INVENTORY_BELOW,
    INVENTORY_ABOVE,
    BACKLOG_BELOW,
    BACKLOG_ABOVE,
    DEBT_ABOVE,
    NET_WORTH_BELOW,
    DAY_RANGE
}
