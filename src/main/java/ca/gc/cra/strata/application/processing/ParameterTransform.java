package ca.gc.cra.strata.application.processing;

/**
 * One-argument transform applied to a parameter value.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ParameterTransform {

  /**
   * Transforms a value.
   *
   * @param value current value, possibly {@code null}
   * @return transformed value
   * @throws Exception when the value is rejected; wrapped by the registry
   */
  Object apply(Object value) throws Exception;

  /**
   * Composes this transform with {@code next}.
   *
   * @param next transform applied to the output of this one
   * @return composed transform
   */
  default ParameterTransform andThen(ParameterTransform next) {
    return value -> next.apply(apply(value));
  }
}
