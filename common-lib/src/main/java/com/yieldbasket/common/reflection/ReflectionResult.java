package com.yieldbasket.common.reflection;

import com.yieldbasket.common.model.ProducerKind;

import java.util.Map;

/**
 * @param realizedNavChange fractional NAV move since the decision
 * @param decisionEdge      return of the final weights minus return of the prior weights
 */
public record ReflectionResult(
    Map<ProducerKind, Double> producerAccuracy,
    double realizedNavChange,
    double decisionEdge,
    ProducerKind bestProducer,
    ProducerKind worstProducer,
    String note
) {}
