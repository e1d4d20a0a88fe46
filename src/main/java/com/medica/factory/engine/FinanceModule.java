package com.medica.factory.engine;

import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.SimulationState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cash and debt bookkeeping. Cash never goes negative: a payment larger than
 * the balance borrows the shortfall and books the commission as debt.
 */
@Slf4j
@Component
public class FinanceModule {

    public void takeLoan(SimulationState state, double amount, double commissionRate) {
        if (amount <= 0) {
            return;
        }
        state.setCash(state.getCash() + amount);
        state.setDebt(state.getDebt() + amount * (1 + commissionRate));
    }

    /**
     * Repays up to {@code amount}, limited by outstanding debt and available cash.
     *
     * @return amount actually repaid
     */
    public double payDebt(SimulationState state, double amount) {
        double paid = Math.min(amount, Math.min(state.getDebt(), state.getCash()));
        if (paid <= 0) {
            return 0;
        }
        state.setCash(state.getCash() - paid);
        state.setDebt(state.getDebt() - paid);
        return paid;
    }

    /**
     * Pays {@code amount} out of cash, borrowing any shortfall.
     *
     * @return size of the automatic loan, 0 if none was needed
     */
    public double processPayment(SimulationState state, double amount, PaymentKind kind) {
        if (amount <= 0) {
            return 0;
        }
        double loan = 0;
        if (state.getCash() < amount) {
            loan = amount - state.getCash();
            takeLoan(state, loan, kind.getLoanCommission());
            log.debug("Day {}: auto-borrowed {} ({}) to cover payment of {}",
                    state.getCurrentDay(), String.format("%.2f", loan), kind, String.format("%.2f", amount));
        }
        // floating point residue from the loan arithmetic is clamped away
        state.setCash(Math.max(0, state.getCash() - amount));
        state.setTotalCosts(state.getTotalCosts() + amount);
        return loan;
    }

    public void receive(SimulationState state, double amount) {
        if (amount <= 0) {
            return;
        }
        state.setCash(state.getCash() + amount);
        state.setTotalRevenue(state.getTotalRevenue() + amount);
    }

    /**
     * Charges a day of debt interest (paid in cash) and credits a day of cash interest.
     *
     * @return interest charged on debt
     */
    public double applyDailyInterest(SimulationState state) {
        double interest = state.getDebt() * FactoryConstants.DAILY_DEBT_INTEREST_RATE;
        if (interest > 0) {
            processPayment(state, interest, PaymentKind.PLANNED);
            state.setTotalInterestPaid(state.getTotalInterestPaid() + interest);
        }
        double earned = state.getCash() * FactoryConstants.DAILY_CASH_INTEREST_RATE;
        state.setCash(state.getCash() + earned);
        return interest;
    }
}
