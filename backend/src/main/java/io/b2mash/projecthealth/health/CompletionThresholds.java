package io.b2mash.projecthealth.health;

/**
 * Minimum weighted completion needed for green and for yellow; anything below {@code yellowAt} is
 * red.
 */
record CompletionThresholds(int greenAt, int yellowAt) {

  static final int UNREACHABLE = Integer.MAX_VALUE;

  StatusColor colorFor(int completion) {
    if (completion >= greenAt) {
      return StatusColor.GREEN;
    }
    if (completion >= yellowAt) {
      return StatusColor.YELLOW;
    }
    return StatusColor.RED;
  }

  String describe() {
    String yellow = "yellow at >= " + yellowAt + "%";
    if (greenAt == UNREACHABLE) {
      return yellow + ", green unreachable";
    }
    return "green at >= " + greenAt + "%, " + yellow;
  }
}
