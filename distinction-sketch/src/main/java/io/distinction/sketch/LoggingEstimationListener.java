package io.distinction.sketch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingEstimationListener implements EstimationListener
{
  private static final Logger LOG = LoggerFactory.getLogger(LoggingEstimationListener.class);

  public static final LoggingEstimationListener INSTANCE = new LoggingEstimationListener();

  @Override
  public void onStart(long length, long threshold)
  {
    LOG.info("Initializing; p = {} m = {} thresh = {}", 1.0, length, threshold);
  }

  @Override
  public void onThinned(long index, double probability, int sampleSize)
  {
    LOG.debug("Thinned sample at element #{}; p = {} size = {}", index, probability, sampleSize);
  }

  @Override
  public void onThresholdExhausted(long index, long threshold)
  {
    LOG.warn(
        "Exiting at element #{}: sample still holds thresh = {} elements after thinning, reporting 0",
        index,
        threshold
    );
  }

  @Override
  public void onFinish(double probability, int sampleSize, long estimate)
  {
    LOG.info("Finished calculating; p = {} size = {} estimate = {}", probability, sampleSize, estimate);
  }
}
