package io.distinction.sketch;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;

/**
 * Entry points for estimating the number of distinct elements of a finite stream in a single pass.
 *
 * <p>A returned 0 means either that the stream was empty or that the sample could not be thinned below
 * its threshold (bounds too tight for this run). Use {@link #estimateWithDetails} to tell them apart.
 */
public final class CardinalityEstimators
{
  private static final Logger LOG = LoggerFactory.getLogger(CardinalityEstimators.class);

  private CardinalityEstimators()
  {
  }

  public static <T> long estimate(List<? extends T> stream, double eps, double delta)
  {
    return estimate(stream, eps, delta, RandomSource.fromEntropy());
  }

  public static <T> long estimate(List<? extends T> stream, double eps, double delta, RandomSource random)
  {
    Preconditions.checkNotNull(stream, "stream");
    return estimate(stream, stream.size(), new ErrorBounds(eps, delta), random);
  }

  /**
   * Estimates over a stream that is only iterated once, such as a lazily generated one.
   *
   * @param length number of elements {@code stream} yields, used to size the sample threshold
   */
  public static <T> long estimate(Iterable<? extends T> stream, long length, ErrorBounds bounds, RandomSource random)
  {
    return estimateWithDetails(stream, length, bounds, random, LoggingEstimationListener.INSTANCE).estimate();
  }

  /**
   * @throws IllegalStateException if {@code stream} yields more than {@code length} elements
   */
  public static <T> EstimationResult estimateWithDetails(
      Iterable<? extends T> stream,
      long length,
      ErrorBounds bounds,
      RandomSource random,
      EstimationListener listener
  )
  {
    Preconditions.checkNotNull(stream, "stream");
    Preconditions.checkNotNull(bounds, "bounds");
    Preconditions.checkNotNull(random, "random");
    Preconditions.checkNotNull(listener, "listener");
    Preconditions.checkArgument(length >= 0, "invalid stream length [%s] : should not be negative", length);

    final Iterator<? extends T> it = stream.iterator();
    if (length == 0) {
      Preconditions.checkState(!it.hasNext(), "more elements than the declared stream length 0");
      LOG.debug("Empty stream; estimate = 0");
      return EstimationResult.empty();
    }

    final CvmSketch<T> sketch = new CvmSketch<>(length, bounds, random, listener);
    while (it.hasNext() && !sketch.isThresholdExhausted()) {
      sketch.add(it.next());
    }
    return sketch.finish();
  }

  public static <T> CvmSketch<T> newCvmSketch(long length, ErrorBounds bounds, RandomSource random)
  {
    return new CvmSketch<>(length, bounds, random, LoggingEstimationListener.INSTANCE);
  }

  /**
   * @return a supplier of fresh sketches, each with its own entropy seeded random source
   */
  public static <T> Supplier<CvmSketch<T>> lazyGet(long length, ErrorBounds bounds)
  {
    return () -> new CvmSketch<>(length, bounds, RandomSource.fromEntropy(), EstimationListener.NOOP);
  }
}
