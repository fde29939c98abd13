package ca.gc.cra.diagsink.application.sink;

/**
 * Outcome of one reclaim pass over the retired segments.
 *
 * @param closed handles closed and removed during the pass
 * @param failed handles whose close failed; they stay retired for the next pass
 * @param remaining retired handles left after the pass
 * @since 0.1.0
 */
public record ReclaimResult(int closed, int failed, int remaining) {
  static final ReclaimResult NONE = new ReclaimResult(0, 0, 0);
}
