package io.distinction.sketch;

import com.google.common.base.Preconditions;

import java.util.SplittableRandom;

public class SplittableRandomSource implements RandomSource
{
  private final SplittableRandom random;

  public SplittableRandomSource(SplittableRandom random)
  {
    this.random = Preconditions.checkNotNull(random, "random");
  }

  @Override
  public double nextDouble()
  {
    return random.nextDouble();
  }

  @Override
  public int nextInt(int bound)
  {
    Preconditions.checkArgument(bound > 0, "invalid bound [%s] : should be positive", bound);
    return random.nextInt(bound);
  }
}
