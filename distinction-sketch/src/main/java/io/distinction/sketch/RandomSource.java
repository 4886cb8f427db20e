package io.distinction.sketch;

import java.security.SecureRandom;
import java.util.SplittableRandom;

/**
 * Source of the uniform draws consumed by a sketch.
 *
 * <p>Implementations are not required to be thread safe: a source belongs to one estimation at a time.
 */
public interface RandomSource
{
  /**
   * @return a uniformly distributed value in [0, 1)
   */
  double nextDouble();

  /**
   * @return a uniformly distributed value in [0, bound)
   */
  int nextInt(int bound);

  /**
   * Two sources created from the same seed produce the same sequence of draws.
   */
  static RandomSource seeded(long seed)
  {
    return new SplittableRandomSource(new SplittableRandom(seed));
  }

  static RandomSource fromEntropy()
  {
    return new SplittableRandomSource(new SplittableRandom(new SecureRandom().nextLong()));
  }
}
