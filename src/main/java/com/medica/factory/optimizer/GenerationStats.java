package com.medica.factory.optimizer;

import lombok.Value;

@Value
public class GenerationStats {
    int generation;
    double bestFitness;
    double averageFitness;
    double worstFitness;
    double diversity;       // mean pairwise normalized gene distance
}
