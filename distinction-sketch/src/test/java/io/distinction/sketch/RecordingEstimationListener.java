package io.distinction.sketch;

import java.util.ArrayList;
import java.util.List;

class RecordingEstimationListener implements EstimationListener
{
  final List<Double> probabilities = new ArrayList<>();
  final List<Integer> sampleSizes = new ArrayList<>();
  final List<Long> thinnedAt = new ArrayList<>();
  long startedThreshold = -1;
  long exhaustedAt = -1;
  long finishedEstimate = -1;
  int starts;
  int finishes;

  @Override
  public void onStart(long length, long threshold)
  {
    starts++;
    startedThreshold = threshold;
  }

  @Override
  public void onThinned(long index, double probability, int sampleSize)
  {
    thinnedAt.add(index);
    probabilities.add(probability);
    sampleSizes.add(sampleSize);
  }

  @Override
  public void onThresholdExhausted(long index, long threshold)
  {
    exhaustedAt = index;
  }

  @Override
  public void onFinish(double probability, int sampleSize, long estimate)
  {
    finishes++;
    finishedEstimate = estimate;
  }
}
