package com.airquality.karachi.serving;

/**
 * A trained model, supplied from outside. Inputs arrive in Feature Spec order.
 */
@FunctionalInterface
public interface Predictor {

    double predict(double[] features);
}
