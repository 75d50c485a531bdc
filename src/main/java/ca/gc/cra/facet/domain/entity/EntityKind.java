package ca.gc.cra.facet.domain.entity;

/**
 * Shape of an extracted entity.
 *
 * @since FACET 0.1.0
 */
public enum EntityKind {
  /** Two bounds joined by an operator. */
  RANGE,
  /** A single value. */
  SCALAR
}
