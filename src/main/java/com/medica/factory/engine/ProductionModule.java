package com.medica.factory.engine;

import com.medica.factory.domain.CustomOrder;
import com.medica.factory.domain.CustomStation;
import com.medica.factory.domain.FactoryConstants;
import com.medica.factory.domain.MachineType;
import com.medica.factory.domain.SimulationState;
import com.medica.factory.domain.StandardLineWip;
import com.medica.factory.domain.Strategy;
import com.medica.factory.domain.WipBatch;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Daily flow through both lines. MCE is shared by share, ARCP is shared by priority
 * (standard first, custom gets whatever labor is left including the fractional part).
 * Shortfalls of material or capacity only cap throughput.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductionModule {

    private final InventoryModule inventory;
    private final FinanceModule finance;

    @Value
    public static class MceAllocation {
        int totalCapacity;
        int customCapacity;
        int standardCapacity;
    }

    /** What happened on the shop floor today. */
    @Data
    public static class ProductionReport {
        private int admittedOrders;
        private int rejectedOrders;
        private int customStarted;
        private int standardStarted;
        private int standardCompleted;
        private int customCompleted;
        private int lateCompleted;
        private long deliveryDaysCompleted;
        private int materialShortfall;
        private int mceCapacity;
        private double arcpCapacity;
        private double arcpUsed;

        public double averageDeliveryDays() {
            return customCompleted == 0 ? 0 : (double) deliveryDaysCompleted / customCompleted;
        }

        public double mceUtilization() {
            return mceCapacity == 0 ? 0 : (double) (customStarted + standardStarted) / mceCapacity;
        }
    }

    /**
     * Splits MCE capacity between lines, rounding each share down.
     * Tiny capacities can leave a line with nothing: 1 unit at 30% custom gives 0 to custom.
     */
    public MceAllocation allocateMceCapacity(int mceMachines, double mceAllocationCustom) {
        return splitCapacity(Math.max(0, mceMachines) * FactoryConstants.MCE_UNITS_PER_MACHINE, mceAllocationCustom);
    }

    public static MceAllocation splitCapacity(int total, double mceAllocationCustom) {
        double share = Math.max(0, Math.min(1, mceAllocationCustom));
        // epsilon keeps e.g. 30 * 0.7 from landing on 20.999...
        int custom = (int) Math.floor(total * share + 1e-9);
        int standard = (int) Math.floor(total * (1 - share) + 1e-9);
        return new MceAllocation(total, custom, standard);
    }

    public ProductionReport runDay(SimulationState state, Strategy strategy, int incomingOrders, double arcpCapacity) {
        ProductionReport report = new ProductionReport();
        MceAllocation allocation = allocateMceCapacity(state.getMachineCount(MachineType.MCE),
                strategy.getMceAllocationCustom());
        report.setMceCapacity(allocation.getTotalCapacity());
        report.setArcpCapacity(arcpCapacity);

        admitCustomOrders(state, incomingOrders, report);

        state.getCustomOrders().sort(Comparator.comparingInt(CustomOrder::getStartDay));
        Map<CustomOrder, Boolean> movedToday = new IdentityHashMap<>();

        processArcp(state, arcpCapacity, movedToday, report);
        advanceCustomLine(state, allocation, movedToday, report);
        advanceStandardLine(state, strategy, allocation, report);
        ageCustomOrders(state);
        return report;
    }

    /**
     * Admission control: orders beyond the WIP ceiling are rejected, not queued.
     */
    public void admitCustomOrders(SimulationState state, int incomingOrders, ProductionReport report) {
        for (int i = 0; i < incomingOrders; i++) {
            if (state.getCustomOrders().size() >= FactoryConstants.MAX_CUSTOM_WIP) {
                report.setRejectedOrders(report.getRejectedOrders() + 1);
                continue;
            }
            state.getCustomOrders().add(CustomOrder.builder()
                    .orderId(state.nextOrderId())
                    .startDay(state.getCurrentDay())
                    .station(CustomStation.WAITING)
                    .build());
            report.setAdmittedOrders(report.getAdmittedOrders() + 1);
        }
        if (report.getRejectedOrders() > 0) {
            state.setRejectedCustomOrders(state.getRejectedCustomOrders() + report.getRejectedOrders());
            log.debug("Day {}: custom WIP full, rejected {} order(s)", state.getCurrentDay(), report.getRejectedOrders());
        }
    }

    // ---------------------------------------------------------
    // ARCP: shared labor station
    // ---------------------------------------------------------

    private void processArcp(SimulationState state, double arcpCapacity,
                             Map<CustomOrder, Boolean> movedToday, ProductionReport report) {
        List<WipBatch> queue = state.getStandardLineWip().getArcpQueue();
        int standardBudget = (int) Math.floor(arcpCapacity + 1e-9);
        int standardDone = takeUnits(queue, standardBudget);
        state.setFinishedStandard(state.getFinishedStandard() + standardDone);
        state.setTotalStandardCompleted(state.getTotalStandardCompleted() + standardDone);
        report.setStandardCompleted(standardDone);

        int customBudget = (int) Math.floor(arcpCapacity - standardDone + 1e-9);
        int customDone = 0;
        Iterator<CustomOrder> it = state.getCustomOrders().iterator();
        while (it.hasNext() && customDone < customBudget) {
            CustomOrder order = it.next();
            if (order.getStation() != CustomStation.ARCP || order.getDaysAtStation() < FactoryConstants.CUSTOM_MIN_DWELL_DAYS) {
                continue;
            }
            it.remove();
            movedToday.put(order, Boolean.TRUE);
            customDone++;
            int deliveryDays = state.getCurrentDay() - order.getStartDay();
            report.setDeliveryDaysCompleted(report.getDeliveryDaysCompleted() + deliveryDays);
            if (deliveryDays > FactoryConstants.LATE_DELIVERY_DAYS) {
                report.setLateCompleted(report.getLateCompleted() + 1);
            }
            state.setMaxDeliveryDays(Math.max(state.getMaxDeliveryDays(), deliveryDays));
        }
        state.setFinishedCustom(state.getFinishedCustom() + customDone);
        state.setTotalCustomCompleted(state.getTotalCustomCompleted() + customDone);
        state.setDeliveredCustomOrders(state.getDeliveredCustomOrders() + customDone);
        state.setLateDeliveries(state.getLateDeliveries() + report.getLateCompleted());
        state.setTotalDeliveryDays(state.getTotalDeliveryDays() + report.getDeliveryDaysCompleted());
        report.setCustomCompleted(customDone);
        report.setArcpUsed(standardDone + customDone);
    }

    // ---------------------------------------------------------
    // Custom line, downstream stations first so an order moves at most once a day
    // ---------------------------------------------------------

    private void advanceCustomLine(SimulationState state, MceAllocation allocation,
                                   Map<CustomOrder, Boolean> movedToday, ProductionReport report) {
        int pucCapacity = state.getMachineCount(MachineType.PUC) * FactoryConstants.CUSTOM_UNITS_PER_MACHINE;
        int wmaCapacity = state.getMachineCount(MachineType.WMA) * FactoryConstants.CUSTOM_UNITS_PER_MACHINE;

        move(state, CustomStation.PUC, pucCapacity, movedToday);
        int wmaUsed = move(state, CustomStation.WMA_PASS2, wmaCapacity, movedToday);
        move(state, CustomStation.WMA_PASS1, wmaCapacity - wmaUsed, movedToday);
        move(state, CustomStation.MCE, Integer.MAX_VALUE, movedToday);

        // WAITING -> MCE needs MCE share and one unit of material per order
        int waiting = (int) state.getCustomOrders().stream()
                .filter(o -> o.getStation() == CustomStation.WAITING).count();
        int wanted = Math.min(waiting, allocation.getCustomCapacity());
        InventoryModule.Consumption drawn = inventory.consume(state,
                wanted * FactoryConstants.CUSTOM_MATERIAL_PER_UNIT);
        int starts = drawn.getConsumed() / FactoryConstants.CUSTOM_MATERIAL_PER_UNIT;
        report.setMaterialShortfall(report.getMaterialShortfall() + drawn.getShortfall());

        int started = 0;
        for (CustomOrder order : state.getCustomOrders()) {
            if (started >= starts) {
                break;
            }
            if (order.getStation() == CustomStation.WAITING) {
                order.setStation(CustomStation.MCE);
                order.setDaysAtStation(0);
                movedToday.put(order, Boolean.TRUE);
                started++;
            }
        }
        report.setCustomStarted(started);
    }

    private int move(SimulationState state, CustomStation from, int capacity, Map<CustomOrder, Boolean> movedToday) {
        int moved = 0;
        for (CustomOrder order : state.getCustomOrders()) {
            if (moved >= capacity) {
                break;
            }
            if (order.getStation() != from || movedToday.containsKey(order)
                    || order.getDaysAtStation() < FactoryConstants.CUSTOM_MIN_DWELL_DAYS) {
                continue;
            }
            order.setStation(from.next());
            order.setDaysAtStation(0);
            movedToday.put(order, Boolean.TRUE);
            moved++;
        }
        return moved;
    }

    private void ageCustomOrders(SimulationState state) {
        for (CustomOrder order : state.getCustomOrders()) {
            order.setDaysAtStation(order.getDaysAtStation() + 1);
            if (order.getStation() != CustomStation.WAITING) {
                order.setDaysInProduction(order.getDaysInProduction() + 1);
            }
        }
    }

    // ---------------------------------------------------------
    // Standard line, walked backwards: PUC, WMA, MCE exit, MCE, release
    // ---------------------------------------------------------

    private void advanceStandardLine(SimulationState state, Strategy strategy,
                                     MceAllocation allocation, ProductionReport report) {
        StandardLineWip wip = state.getStandardLineWip();
        int day = state.getCurrentDay();

        for (WipBatch batch : countDown(wip.getStation3())) {
            batch.setDaysRemaining(0);
            wip.getArcpQueue().add(batch);
        }
        for (WipBatch batch : countDown(wip.getStation2())) {
            batch.setDaysRemaining(FactoryConstants.STANDARD_PUC_DWELL_DAYS);
            wip.getStation3().add(batch);
        }
        for (WipBatch batch : countDown(wip.getStation1())) {
            batch.setDaysRemaining(FactoryConstants.STANDARD_WMA_DWELL_DAYS);
            wip.getStation2().add(batch);
        }

        releaseBatches(state, strategy, allocation.getStandardCapacity(), report);

        int processed = takeUnits(wip.getPreStation1(), allocation.getStandardCapacity());
        if (processed > 0) {
            wip.getStation1().add(WipBatch.builder().units(processed).startDay(day).daysRemaining(0).build());
        }
        report.setStandardStarted(processed);
    }

    /**
     * Keeps the MCE queue fed by releasing production orders of {@code standardBatchSize} units.
     * Material is drawn at release and each release pays the production order fee.
     */
    private void releaseBatches(SimulationState state, Strategy strategy, int standardCapacity, ProductionReport report) {
        StandardLineWip wip = state.getStandardLineWip();
        int batchSize = Math.max(1, strategy.getStandardBatchSize());
        while (StandardLineWip.units(wip.getPreStation1()) < standardCapacity) {
            int affordable = state.getRawMaterialInventory() / FactoryConstants.STANDARD_MATERIAL_PER_UNIT;
            int units = Math.min(batchSize, affordable);
            if (units < batchSize) {
                report.setMaterialShortfall(report.getMaterialShortfall()
                        + (batchSize - units) * FactoryConstants.STANDARD_MATERIAL_PER_UNIT);
            }
            if (units <= 0) {
                return;
            }
            inventory.consume(state, units * FactoryConstants.STANDARD_MATERIAL_PER_UNIT);
            finance.processPayment(state, FactoryConstants.STANDARD_ORDER_FEE, PaymentKind.PLANNED);
            wip.getPreStation1().add(WipBatch.builder()
                    .units(units).startDay(state.getCurrentDay()).daysRemaining(0).build());
        }
    }

    /** Decrements dwell and removes batches that are done, in FIFO order. */
    private List<WipBatch> countDown(List<WipBatch> stage) {
        List<WipBatch> done = new ArrayList<>();
        Iterator<WipBatch> it = stage.iterator();
        while (it.hasNext()) {
            WipBatch batch = it.next();
            batch.setDaysRemaining(batch.getDaysRemaining() - 1);
            if (batch.getDaysRemaining() <= 0) {
                it.remove();
                done.add(batch);
            }
        }
        return done;
    }

    /** Removes up to {@code limit} units from the front of a stage, splitting a batch if needed. */
    private int takeUnits(List<WipBatch> stage, int limit) {
        int taken = 0;
        Iterator<WipBatch> it = stage.iterator();
        while (it.hasNext() && taken < limit) {
            WipBatch batch = it.next();
            int take = Math.min(batch.getUnits(), limit - taken);
            batch.setUnits(batch.getUnits() - take);
            taken += take;
            if (batch.getUnits() == 0) {
                it.remove();
            }
        }
        return taken;
    }
}
