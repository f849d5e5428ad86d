package io.github.granulefilter.cli.estimate;

/**
 * Estimates the number of compute nodes needed to process a number of granules.
 */
public class NodeEstimator {

  /**
   * Nodes required to process the granules within the walltime.
   *
   * <p>{@code ceil(hoursPerGranule * granuleCount / (walltimeHours * workers))}; minutes and
   * seconds of the walltime are ignored.
   *
   * @param granuleCount    granules to process
   * @param walltime        job walltime as {@code hh:mm:ss}
   * @param workers         workers per node
   * @param hoursPerGranule processing cost of one granule
   * @return the number of nodes
   * @throws IllegalArgumentException if the walltime is malformed or shorter than an hour
   */
  public int nodesRequired(
      final long granuleCount,
      final String walltime,
      final int workers,
      final double hoursPerGranule) {
    if (workers < 1) {
      throw new IllegalArgumentException("Workers must be positive: " + workers);
    }
    final int hours = walltimeHours(walltime);
    return (int) Math.ceil(hoursPerGranule * granuleCount / ((double) hours * workers));
  }

  /**
   * Whole hours of a {@code hh:mm:ss} walltime.
   *
   * @param walltime the walltime
   * @return the hours
   */
  static int walltimeHours(final String walltime) {
    final String[] parts = walltime.trim().split(":");
    if (parts.length != 3) {
      throw new IllegalArgumentException("Walltime must be hh:mm:ss: " + walltime);
    }
    final int hours;
    try {
      hours = Integer.parseInt(parts[0]);
      Integer.parseInt(parts[1]);
      Integer.parseInt(parts[2]);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Walltime must be hh:mm:ss: " + walltime, e);
    }
    if (hours < 1) {
      throw new IllegalArgumentException("Walltime must be at least one hour: " + walltime);
    }
    return hours;
  }
}
