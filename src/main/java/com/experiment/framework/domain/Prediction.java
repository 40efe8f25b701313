package com.experiment.framework.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Structured value of an accuracy metric event: what the model predicted and what actually happened.
 */
@Value
@Builder
@Jacksonized
public class Prediction {

    boolean predicted;
    boolean actual;

    public boolean isCorrect() {
        return predicted == actual;
    }
}
