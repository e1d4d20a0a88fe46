package com.medica.factory.optimizer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Eight bounded knobs that scale the analytical baseline strategy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StrategyGenes {
    private double safetyStockMultiplier;
    private double targetCapacityMultiplier;
    private double workforceAggressiveness;
    private double priceAggressiveness;
    private double customPriceMultiplier;
    private double mceAllocationCustom;
    private double debtPaydownAggressiveness;
    private double minCashReserveDays;

    static final double MUTATION_SPREAD = 0.10;
    static final int INTEGER_MUTATION_STEP = 3;

    public static StrategyGenes defaults() {
        StrategyGenes genes = new StrategyGenes();
        for (Gene gene : Gene.values()) {
            genes.set(gene, gene.getDefaultValue());
        }
        return genes;
    }

    public static StrategyGenes random(Random random) {
        StrategyGenes genes = new StrategyGenes();
        for (Gene gene : Gene.values()) {
            genes.set(gene, gene.clamp(gene.getMin() + random.nextDouble() * gene.span()));
        }
        return genes;
    }

    public double get(Gene gene) {
        return switch (gene) {
            case SAFETY_STOCK_MULTIPLIER -> safetyStockMultiplier;
            case TARGET_CAPACITY_MULTIPLIER -> targetCapacityMultiplier;
            case WORKFORCE_AGGRESSIVENESS -> workforceAggressiveness;
            case PRICE_AGGRESSIVENESS -> priceAggressiveness;
            case CUSTOM_PRICE_MULTIPLIER -> customPriceMultiplier;
            case MCE_ALLOCATION_CUSTOM -> mceAllocationCustom;
            case DEBT_PAYDOWN_AGGRESSIVENESS -> debtPaydownAggressiveness;
            case MIN_CASH_RESERVE_DAYS -> minCashReserveDays;
        };
    }

    public void set(Gene gene, double value) {
        switch (gene) {
            case SAFETY_STOCK_MULTIPLIER -> safetyStockMultiplier = value;
            case TARGET_CAPACITY_MULTIPLIER -> targetCapacityMultiplier = value;
            case WORKFORCE_AGGRESSIVENESS -> workforceAggressiveness = value;
            case PRICE_AGGRESSIVENESS -> priceAggressiveness = value;
            case CUSTOM_PRICE_MULTIPLIER -> customPriceMultiplier = value;
            case MCE_ALLOCATION_CUSTOM -> mceAllocationCustom = value;
            case DEBT_PAYDOWN_AGGRESSIVENESS -> debtPaydownAggressiveness = value;
            case MIN_CASH_RESERVE_DAYS -> minCashReserveDays = value;
        }
    }

    public StrategyGenes copy() {
        return toBuilder().build();
    }

    public StrategyGenes clamp() {
        StrategyGenes clamped = copy();
        for (Gene gene : Gene.values()) {
            clamped.set(gene, gene.clamp(get(gene)));
        }
        return clamped;
    }

    /**
     * Each gene mutates with probability {@code rate}: floats move up to 10% of their value,
     * the integer gene steps by up to 3. Results stay in range.
     */
    public StrategyGenes mutate(double rate, Random random) {
        StrategyGenes mutated = copy();
        for (Gene gene : Gene.values()) {
            if (random.nextDouble() >= rate) {
                continue;
            }
            double value = get(gene);
            if (gene.isInteger()) {
                value += random.nextInt(2 * INTEGER_MUTATION_STEP + 1) - INTEGER_MUTATION_STEP;
            } else {
                value += value * (random.nextDouble() * 2 - 1) * MUTATION_SPREAD;
            }
            mutated.set(gene, gene.clamp(value));
        }
        return mutated;
    }

    /** Uniform crossover: each gene comes from either parent with equal odds. */
    public StrategyGenes crossover(StrategyGenes other, Random random) {
        StrategyGenes child = new StrategyGenes();
        for (Gene gene : Gene.values()) {
            child.set(gene, random.nextBoolean() ? get(gene) : other.get(gene));
        }
        return child;
    }

    /** Pins genes to fixed values; used when part of the strategy is decided up front. */
    public StrategyGenes withOverrides(Map<Gene, Double> fixed) {
        StrategyGenes pinned = copy();
        fixed.forEach((gene, value) -> pinned.set(gene, gene.clamp(value)));
        return pinned;
    }

    public double[] toArray() {
        double[] values = new double[Gene.values().length];
        for (Gene gene : Gene.values()) {
            values[gene.ordinal()] = get(gene);
        }
        return values;
    }

    public static StrategyGenes fromArray(double[] values) {
        if (values.length != Gene.values().length) {
            throw new IllegalArgumentException("Expected " + Gene.values().length + " genes, got " + values.length);
        }
        StrategyGenes genes = new StrategyGenes();
        for (Gene gene : Gene.values()) {
            genes.set(gene, values[gene.ordinal()]);
        }
        return genes;
    }

    /** Euclidean distance with every gene scaled to [0, 1]. */
    public double normalizedDistance(StrategyGenes other) {
        double sum = 0;
        for (Gene gene : Gene.values()) {
            double d = (get(gene) - other.get(gene)) / gene.span();
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /** Mean pairwise normalized distance; 0 for fewer than two members. */
    public static double diversity(List<StrategyGenes> population) {
        int n = population.size();
        if (n < 2) {
            return 0;
        }
        double total = 0;
        int pairs = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                total += population.get(i).normalizedDistance(population.get(j));
                pairs++;
            }
        }
        return total / pairs;
    }
}
