package com.medica.factory.optimizer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyGenesTest {

    @Test
    void mutationStaysInsideBounds() {
        Random random = new Random(17);
        StrategyGenes genes = StrategyGenes.random(random);
        for (int i = 0; i < 500; i++) {
            genes = genes.mutate(1.0, random);
            for (Gene gene : Gene.values()) {
                assertThat(genes.get(gene)).as(gene.name()).isBetween(gene.getMin(), gene.getMax());
            }
        }
        double days = genes.get(Gene.MIN_CASH_RESERVE_DAYS);
        assertThat(days).isEqualTo(Math.rint(days));
    }

    @Test
    void mutationDoesNotTouchTheOriginal() {
        StrategyGenes original = StrategyGenes.defaults();
        original.mutate(1.0, new Random(1));

        assertThat(original).isEqualTo(StrategyGenes.defaults());
    }

    @Test
    void crossoverTakesEveryGeneFromAParent() {
        Random random = new Random(5);
        StrategyGenes a = StrategyGenes.random(random);
        StrategyGenes b = StrategyGenes.random(random);

        StrategyGenes child = a.crossover(b, random);

        for (Gene gene : Gene.values()) {
            assertThat(child.get(gene)).isIn(a.get(gene), b.get(gene));
        }
    }

    @Test
    void overridesArePinnedAndClamped() {
        StrategyGenes pinned = StrategyGenes.defaults()
                .withOverrides(Map.of(Gene.MCE_ALLOCATION_CUSTOM, 0.9, Gene.PRICE_AGGRESSIVENESS, 1.05));

        assertThat(pinned.getMceAllocationCustom()).isEqualTo(0.7);
        assertThat(pinned.getPriceAggressiveness()).isEqualTo(1.05);
    }

    @Test
    void diversityIsZeroForClonesAndPositiveOtherwise() {
        StrategyGenes genes = StrategyGenes.defaults();
        Random random = new Random(3);

        assertThat(StrategyGenes.diversity(List.of(genes, genes.copy()))).isZero();
        assertThat(StrategyGenes.diversity(List.of(genes))).isZero();
        assertThat(StrategyGenes.diversity(List.of(genes, StrategyGenes.random(random)))).isPositive();
    }

    @Test
    void arrayFormMatchesGeneOrder() {
        StrategyGenes genes = StrategyGenes.defaults();

        assertThat(StrategyGenes.fromArray(genes.toArray())).isEqualTo(genes);
        assertThatThrownBy(() -> StrategyGenes.fromArray(new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
