package io.distinction.sketch;

/**
 * Receives the progress of one estimation. Callbacks are advisory: nothing a listener does changes
 * the estimate.
 */
public interface EstimationListener
{
  EstimationListener NOOP = new EstimationListener() {};

  /**
   * Called once the threshold is known, with the sampling probability at 1.0.
   */
  default void onStart(long length, long threshold)
  {
  }

  /**
   * Called after each thinning round.
   *
   * @param index      zero-based position of the element that filled the sample
   * @param probability sampling probability after halving
   * @param sampleSize sample size after thinning
   */
  default void onThinned(long index, double probability, int sampleSize)
  {
  }

  /**
   * Called when thinning left the sample at the threshold and the pass stops with an estimate of 0.
   */
  default void onThresholdExhausted(long index, long threshold)
  {
  }

  default void onFinish(double probability, int sampleSize, long estimate)
  {
  }
}
