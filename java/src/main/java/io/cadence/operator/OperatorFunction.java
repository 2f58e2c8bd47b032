package io.cadence.operator;

import io.cadence.generator.Operator;
import io.cadence.generator.OperatorConfig;

/** Builds an operator once its timezone and base are known. */
@FunctionalInterface
public interface OperatorFunction {
  Operator apply(OperatorConfig config);
}
