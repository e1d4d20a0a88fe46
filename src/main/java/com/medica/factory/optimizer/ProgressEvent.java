package com.medica.factory.optimizer;

import lombok.Value;

@Value
public class ProgressEvent {
    int iteration;
    int total;
    String phase;           // "random", "guided", "generation", ...
    double bestFitness;
}
