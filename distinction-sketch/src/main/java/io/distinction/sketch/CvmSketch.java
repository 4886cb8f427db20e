package io.distinction.sketch;

import com.google.common.base.Preconditions;

/**
 * Implements the distinct elements estimator of Chakraborty, Vinodchandran and Meel,
 * described in https://arxiv.org/abs/2301.10191.
 *
 * <p>The sketch keeps a random sample of the distinct values seen so far. Every element is dropped from
 * the sample and then re-admitted with the current sampling probability {@code p}. When the sample reaches
 * the threshold, each member is kept with probability 1/2 and {@code p} is halved. The estimate is
 * {@code |sample| / p}.
 *
 * <p>The threshold depends on the stream length, so the length must be declared up front. Memory is
 * bounded by the threshold, not by the length. The sketch keeps references to the added values and never
 * copies them; values must implement {@code equals} and {@code hashCode}.
 *
 * <p>If thinning ever leaves the sample at the threshold the sketch stops sampling and reports 0.
 * This happens with negligible probability for sensible bounds, but it means a cardinality of 0 does not
 * prove that no values were added; see {@link #isThresholdExhausted()}.
 *
 * <p>Not thread safe. Merging two sketches is not supported.
 */
public class CvmSketch<T> implements CardinalityEstimator<T>
{
  private final long length;
  private final long threshold;
  private final RandomSource random;
  private final EstimationListener listener;
  private final SampleBuffer<T> sample = new SampleBuffer<>();

  private double p = 1.0;
  private long consumed;
  private int thinnings;
  private boolean thresholdExhausted;

  public CvmSketch(long length, ErrorBounds bounds, RandomSource random, EstimationListener listener)
  {
    Preconditions.checkNotNull(bounds, "bounds");
    this.random = Preconditions.checkNotNull(random, "random");
    this.listener = Preconditions.checkNotNull(listener, "listener");
    this.length = length;
    this.threshold = bounds.threshold(length);
    listener.onStart(length, threshold);
  }

  @Override
  public void add(T value)
  {
    Preconditions.checkNotNull(value, "element #%s is null", consumed);
    Preconditions.checkState(
        consumed < length,
        "more elements than the declared stream length %s",
        length
    );
    final long index = consumed++;
    if (thresholdExhausted) {
      return;
    }

    sample.remove(value);
    if (random.nextDouble() < p) {
      sample.add(value);
    }

    if (sample.size() == threshold) {
      sample.thin(random);
      p /= 2;
      thinnings++;
      listener.onThinned(index, p, sample.size());

      if (sample.size() == threshold) {
        thresholdExhausted = true;
        listener.onThresholdExhausted(index, threshold);
      }
    }
  }

  /**
   * @return the current estimate, never more than the number of values added so far
   */
  @Override
  public long cardinality()
  {
    if (thresholdExhausted) {
      return 0;
    }
    return Math.min(Math.round(sample.size() / p), consumed);
  }

  /**
   * @return the number of value references held, which stays below the threshold
   */
  @Override
  public long memoryFootprint()
  {
    return sample.size();
  }

  @Override
  public String name()
  {
    return "cvm";
  }

  /**
   * Reports the final state to the listener and returns it. No further values are expected, but the
   * sketch stays usable.
   */
  public EstimationResult finish()
  {
    final long estimate = cardinality();
    if (!thresholdExhausted) {
      listener.onFinish(p, sample.size(), estimate);
    }
    return new EstimationResult(estimate, consumed, threshold, p, sample.size(), thinnings, thresholdExhausted);
  }

  public boolean isThresholdExhausted()
  {
    return thresholdExhausted;
  }

  public long threshold()
  {
    return threshold;
  }

  public double probability()
  {
    return p;
  }

  SampleBuffer<T> sample()
  {
    return sample;
  }
}
