package com.medica.factory.engine;

import com.medica.factory.domain.ActionType;
import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.PolicyTrigger;
import com.medica.factory.domain.ProductLine;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.StrategyAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Applies one {@link StrategyAction}. Dispatch is a switch expression over {@link ActionType},
 * so a new action type does not compile until it has a handler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionExecutor {

    private final FinanceModule finance;
    private final InventoryModule inventory;
    private final WorkforceModule workforce;

    /**
     * @return true if the action changed the state or the active strategy; false if it was skipped
     */
    public boolean execute(SimulationState state, Strategy strategy, StrategyAction action) {
        boolean executed = switch (action.getType()) {
            case ORDER_MATERIALS -> orderMaterials(state, action.getCount());
            case ADJUST_BATCH_SIZE -> {
                strategy.setStandardBatchSize(Math.max(1, (int) Math.round(action.getValue())));
                yield true;
            }
            case ADJUST_MCE_ALLOCATION -> {
                strategy.setMceAllocationCustom(Math.max(0, Math.min(1, action.getValue())));
                yield true;
            }
            case HIRE_ROOKIE -> {
                workforce.hireRookies(state, Math.max(0, action.getCount()));
                yield action.getCount() > 0;
            }
            case HIRE_EXPERT -> {
                workforce.hireExperts(state, Math.max(0, action.getCount()));
                yield action.getCount() > 0;
            }
            case TAKE_LOAN -> {
                finance.takeLoan(state, action.getAmount(), FactoryConstants.PLANNED_LOAN_COMMISSION);
                yield action.getAmount() > 0;
            }
            case PAY_DEBT -> finance.payDebt(state, action.getAmount()) > 0;
            case BUY_MACHINE -> buyMachine(state, action.getMachineType(), action.getCount());
            case SELL_MACHINE -> sellMachine(state, action.getMachineType(), action.getCount());
            case ADJUST_PRICE -> {
                if (action.getProductLine() == ProductLine.CUSTOM) {
                    strategy.setCustomBasePrice(action.getValue());
                } else {
                    strategy.setStandardPrice(action.getValue());
                }
                yield true;
            }
            case SET_REORDER_POINT -> {
                strategy.setReorderPoint((int) Math.round(action.getValue()));
                yield true;
            }
            case SET_ORDER_QUANTITY -> {
                strategy.setOrderQuantity((int) Math.round(action.getValue()));
                yield true;
            }
        };
        if (!executed) {
            state.setSkippedActions(state.getSkippedActions() + 1);
            log.debug("Day {}: skipped {}", state.getCurrentDay(), action.getType());
        }
        return executed;
    }

    /** The policy recalculation trigger an executed action implies, if any. */
    public static Optional<PolicyTrigger> triggerFor(ActionType type) {
        return switch (type) {
            case BUY_MACHINE -> Optional.of(PolicyTrigger.MACHINE_PURCHASED);
            case SELL_MACHINE -> Optional.of(PolicyTrigger.MACHINE_SOLD);
            case HIRE_ROOKIE, HIRE_EXPERT -> Optional.of(PolicyTrigger.EMPLOYEE_HIRED);
            case ORDER_MATERIALS, ADJUST_BATCH_SIZE, ADJUST_MCE_ALLOCATION, TAKE_LOAN, PAY_DEBT,
                    ADJUST_PRICE, SET_REORDER_POINT, SET_ORDER_QUANTITY -> Optional.empty();
        };
    }

    private boolean orderMaterials(SimulationState state, int quantity) {
        if (quantity <= 0) {
            return false;
        }
        inventory.placeOrder(state, quantity);
        return true;
    }

    private boolean buyMachine(SimulationState state, MachineType type, int count) {
        if (type == null || count <= 0) {
            return false;
        }
        double price = type.getBuyPrice() * count;
        if (state.getCash() < price) {
            log.debug("Day {}: cannot afford {} x {} ({} < {})", state.getCurrentDay(), count, type,
                    Math.round(state.getCash()), Math.round(price));
            return false;
        }
        finance.processPayment(state, price, PaymentKind.PLANNED);
        state.setMachineCount(type, state.getMachineCount(type) + count);
        return true;
    }

    private boolean sellMachine(SimulationState state, MachineType type, int count) {
        if (type == null || count <= 0) {
            return false;
        }
        int sold = Math.min(count, state.getMachineCount(type));
        if (sold <= 0) {
            return false;
        }
        state.setMachineCount(type, state.getMachineCount(type) - sold);
        // resale proceeds are capital, not sales revenue
        state.setCash(state.getCash() + sold * type.getSellPrice());
        return true;
    }
}
