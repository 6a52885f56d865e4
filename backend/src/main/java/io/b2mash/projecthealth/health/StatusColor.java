package io.b2mash.projecthealth.health;

/** Traffic-light health color shown on dashboards, status sheets and roadmaps. */
public enum StatusColor {
  GREEN,
  YELLOW,
  RED;

  public String label() {
    return name().toLowerCase();
  }
}
