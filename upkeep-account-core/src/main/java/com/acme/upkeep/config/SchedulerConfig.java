package com.acme.upkeep.config;

import java.time.Duration;

/**
 * Configuration for due-subscription scanning and the upkeep poll. Pure POJO - no framework
 * dependencies.
 */
public class SchedulerConfig {

  public static final int DEFAULT_BATCH_CAP = 10;

  private int batchCap = DEFAULT_BATCH_CAP;
  private boolean rotateScanStart = false; // Ascending scan from id 1 by default
  private Duration pollInterval = Duration.ofSeconds(30);

  public int getBatchCap() {
    return batchCap;
  }

  public void setBatchCap(int batchCap) {
    this.batchCap = batchCap;
  }

  /**
   * When true the scan starts right after the last id handed to executeDue and wraps around, so
   * a run of permanently-due low ids cannot starve higher ids.
   */
  public boolean isRotateScanStart() {
    return rotateScanStart;
  }

  public void setRotateScanStart(boolean rotateScanStart) {
    this.rotateScanStart = rotateScanStart;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }
}
