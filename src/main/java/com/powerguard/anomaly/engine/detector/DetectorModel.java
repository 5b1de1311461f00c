package com.powerguard.anomaly.engine.detector;

import com.powerguard.anomaly.engine.features.FeatureVector;
import com.powerguard.anomaly.model.ModelType;

import java.util.List;

/**
 * Unsupervised detector trained fresh on the batch it scores.
 * Raw scores share one polarity across implementations: higher = more anomalous.
 *
 * @param <S> trained state produced by {@link #fit} and consumed by {@link #score}
 */
public interface DetectorModel<S> {

    ModelType getType();

    S fit(List<FeatureVector> batch);

    double[] score(S trained, List<FeatureVector> vectors);
}
