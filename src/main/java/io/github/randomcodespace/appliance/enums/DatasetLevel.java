package io.github.randomcodespace.appliance.enums;

/** Levels of the per-owner dataset hierarchy, outermost first. */
public enum DatasetLevel {
  USER_ROOT,
  CONTAINERS_ROOT,
  CONTAINER_ROOT,
  WORKSPACE
}
