package io.distinction.sketch;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.math.DoubleMath;

import java.util.Objects;

/**
 * Accuracy parameters of a CVM sketch: the estimate is within a relative error of {@code eps}
 * of the true distinct count with probability at least {@code 1 - delta}.
 */
public final class ErrorBounds
{
  public static final double DEFAULT_EPS = 0.1;
  public static final double DEFAULT_DELTA = 0.005;
  public static final ErrorBounds DEFAULT = new ErrorBounds(DEFAULT_EPS, DEFAULT_DELTA);

  private final double eps;
  private final double delta;

  public ErrorBounds(double eps, double delta)
  {
    Preconditions.checkArgument(
        Double.isFinite(eps) && eps > 0,
        "invalid eps [%s] : should be a finite positive number",
        eps
    );
    Preconditions.checkArgument(
        Double.isFinite(delta) && delta > 0,
        "invalid delta [%s] : should be a finite positive number",
        delta
    );
    this.eps = eps;
    this.delta = delta;
  }

  public double eps()
  {
    return eps;
  }

  public double delta()
  {
    return delta;
  }

  /**
   * Maximum sample size for a stream of {@code m} elements: {@code ceil((12 / eps^2) * log2(8m / delta))}.
   *
   * @throws IllegalArgumentException if {@code m} is not positive, or the bounds do not give a usable
   *                                  threshold for this length (not finite, or below one)
   */
  public long threshold(long m)
  {
    Preconditions.checkArgument(m > 0, "invalid stream length [%s] : should be positive", m);
    final double thresh = Math.ceil(12.0 / (eps * eps) * DoubleMath.log2(8.0 * m / delta));
    Preconditions.checkArgument(
        Double.isFinite(thresh) && thresh >= 1 && thresh < Long.MAX_VALUE,
        "eps [%s] and delta [%s] give an unusable threshold [%s] for stream length %s",
        eps,
        delta,
        thresh,
        m
    );
    return (long) thresh;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ErrorBounds)) {
      return false;
    }
    ErrorBounds that = (ErrorBounds) o;
    return Double.compare(eps, that.eps) == 0 && Double.compare(delta, that.delta) == 0;
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(eps, delta);
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("eps", eps)
                      .add("delta", delta)
                      .toString();
  }
}
