package io.distinction.sketch;

import com.google.common.base.MoreObjects;

/**
 * Outcome of one estimation together with the state it was derived from.
 *
 * <p>An {@link #estimate()} of 0 is ambiguous on its own: it is returned for an empty stream and also
 * when the sample could not be thinned below the threshold. {@link #thresholdExhausted()} separates the two.
 */
public final class EstimationResult
{
  private static final EstimationResult EMPTY = new EstimationResult(0, 0, 0, 1.0, 0, 0, false);

  private final long estimate;
  private final long length;
  private final long threshold;
  private final double probability;
  private final int sampleSize;
  private final int thinnings;
  private final boolean thresholdExhausted;

  EstimationResult(
      long estimate,
      long length,
      long threshold,
      double probability,
      int sampleSize,
      int thinnings,
      boolean thresholdExhausted
  )
  {
    this.estimate = estimate;
    this.length = length;
    this.threshold = threshold;
    this.probability = probability;
    this.sampleSize = sampleSize;
    this.thinnings = thinnings;
    this.thresholdExhausted = thresholdExhausted;
  }

  static EstimationResult empty()
  {
    return EMPTY;
  }

  public long estimate()
  {
    return estimate;
  }

  /**
   * @return the number of stream elements consumed
   */
  public long length()
  {
    return length;
  }

  /**
   * @return the sample size threshold, 0 for an empty stream
   */
  public long threshold()
  {
    return threshold;
  }

  /**
   * @return the final sampling probability, {@code 2^-thinnings()}
   */
  public double probability()
  {
    return probability;
  }

  public int sampleSize()
  {
    return sampleSize;
  }

  public int thinnings()
  {
    return thinnings;
  }

  public boolean thresholdExhausted()
  {
    return thresholdExhausted;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("estimate", estimate)
                      .add("length", length)
                      .add("threshold", threshold)
                      .add("probability", probability)
                      .add("sampleSize", sampleSize)
                      .add("thinnings", thinnings)
                      .add("thresholdExhausted", thresholdExhausted)
                      .toString();
  }
}
