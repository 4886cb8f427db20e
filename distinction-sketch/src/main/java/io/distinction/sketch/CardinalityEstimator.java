package io.distinction.sketch;

public interface CardinalityEstimator<T>
{
  void add(T value);

  long cardinality();
  long memoryFootprint();

  String name();
}
