package com.medica.factory.domain;

public enum HistoryMetric {
    CASH,
    DEBT,
    NET_WORTH,
    RAW_MATERIAL_INVENTORY,
    STANDARD_WIP,
    CUSTOM_WIP,
    STANDARD_PRODUCTION,
    CUSTOM_PRODUCTION,
    STANDARD_PRICE,
    CUSTOM_PRICE,
    DAILY_REVENUE,
    DAILY_COSTS,
    INTEREST_PAID,
    MCE_UTILIZATION,
    CUSTOM_DELIVERY_TIME,
    EXPERTS,
    ROOKIES,
    REJECTED_ORDERS,
    STOCKOUT
}
