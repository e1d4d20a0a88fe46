package com.medica.factory.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A decision stamped with the day it executes. Which payload fields are
 * meaningful depends on {@link #type}; use the static factories to build one.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StrategyAction {
    private int day;
    private ActionType type;
    private int count;                 // materials, hires, machines
    private double amount;             // loans and repayments
    private double value;              // new batch size, allocation, price, reorder point, order quantity
    private MachineType machineType;
    private ProductLine productLine;

    public StrategyAction atDay(int newDay) {
        return toBuilder().day(newDay).build();
    }

    public static StrategyAction orderMaterials(int day, int quantity) {
        return StrategyAction.builder().day(day).type(ActionType.ORDER_MATERIALS).count(quantity).build();
    }

    public static StrategyAction adjustBatchSize(int day, int size) {
        return StrategyAction.builder().day(day).type(ActionType.ADJUST_BATCH_SIZE).value(size).build();
    }

    public static StrategyAction adjustMceAllocation(int day, double allocation) {
        return StrategyAction.builder().day(day).type(ActionType.ADJUST_MCE_ALLOCATION).value(allocation).build();
    }

    public static StrategyAction hireRookie(int day, int count) {
        return StrategyAction.builder().day(day).type(ActionType.HIRE_ROOKIE).count(count).build();
    }

    public static StrategyAction hireExpert(int day, int count) {
        return StrategyAction.builder().day(day).type(ActionType.HIRE_EXPERT).count(count).build();
    }

    public static StrategyAction takeLoan(int day, double amount) {
        return StrategyAction.builder().day(day).type(ActionType.TAKE_LOAN).amount(amount).build();
    }

    public static StrategyAction payDebt(int day, double amount) {
        return StrategyAction.builder().day(day).type(ActionType.PAY_DEBT).amount(amount).build();
    }

    public static StrategyAction buyMachine(int day, MachineType machineType, int count) {
        return StrategyAction.builder().day(day).type(ActionType.BUY_MACHINE)
                .machineType(machineType).count(count).build();
    }

    public static StrategyAction sellMachine(int day, MachineType machineType, int count) {
        return StrategyAction.builder().day(day).type(ActionType.SELL_MACHINE)
                .machineType(machineType).count(count).build();
    }

    public static StrategyAction adjustPrice(int day, ProductLine line, double price) {
        return StrategyAction.builder().day(day).type(ActionType.ADJUST_PRICE)
                .productLine(line).value(price).build();
    }

    public static StrategyAction setReorderPoint(int day, int reorderPoint) {
        return StrategyAction.builder().day(day).type(ActionType.SET_REORDER_POINT).value(reorderPoint).build();
    }

    public static StrategyAction setOrderQuantity(int day, int orderQuantity) {
        return StrategyAction.builder().day(day).type(ActionType.SET_ORDER_QUANTITY).value(orderQuantity).build();
    }
}
