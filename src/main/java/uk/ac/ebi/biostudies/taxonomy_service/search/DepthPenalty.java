package uk.ac.ebi.biostudies.taxonomy_service.search;

/**
 * Score deduction for nodes deep in a hierarchy.
 *
 * <p>Node ids are read as segmented hierarchical codes of two characters per level, where {@code
 * "00"} marks an unused level: {@code "12345600"} sits three levels deep. A trailing
 * one-character segment counts as a level of its own.
 */
public final class DepthPenalty {

  static final double PENALTY_PER_LEVEL = 0.03;
  private static final int SEGMENT_WIDTH = 2;
  private static final String EMPTY_SEGMENT = "00";

  private DepthPenalty() {}

  public static int levels(String id) {
    int levels = 0;
    for (int start = 0; start < id.length(); start += SEGMENT_WIDTH) {
      String segment = id.substring(start, Math.min(start + SEGMENT_WIDTH, id.length()));
      if (!EMPTY_SEGMENT.equals(segment)) {
        levels++;
      }
    }
    return levels;
  }

  public static double of(String id) {
    return PENALTY_PER_LEVEL * levels(id);
  }
}
