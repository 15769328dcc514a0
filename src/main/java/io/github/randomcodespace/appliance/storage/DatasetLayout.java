package io.github.randomcodespace.appliance.storage;

import io.github.randomcodespace.appliance.enums.DatasetLevel;

/**
 * Maps owners and container names onto the dataset hierarchy:
 *
 * <pre>
 * {root}/{owner}                               USER_ROOT (carries the quota)
 * {root}/{owner}/containers                    CONTAINERS_ROOT
 * {root}/{owner}/containers/{name}             CONTAINER_ROOT
 * {root}/{owner}/containers/{name}/workspace   WORKSPACE
 * </pre>
 *
 * Every dataset is mounted at {@code "/" + dataset}. The workspace mount path is also what the
 * expression generator bind-mounts into the container, so its shape must not change on one side
 * only.
 */
public class DatasetLayout {
  private final String root;

  public DatasetLayout(String root) {
    this.root = root;
  }

  public String dataset(DatasetLevel level, String owner, String name) {
    return switch (level) {
      case USER_ROOT -> root + "/" + owner;
      case CONTAINERS_ROOT -> root + "/" + owner + "/containers";
      case CONTAINER_ROOT -> root + "/" + owner + "/containers/" + name;
      case WORKSPACE -> root + "/" + owner + "/containers/" + name + "/workspace";
    };
  }

  public String userRoot(String owner) {
    return dataset(DatasetLevel.USER_ROOT, owner, null);
  }

  public String containersRoot(String owner) {
    return dataset(DatasetLevel.CONTAINERS_ROOT, owner, null);
  }

  public String containerRoot(String owner, String name) {
    return dataset(DatasetLevel.CONTAINER_ROOT, owner, name);
  }

  public String workspace(String owner, String name) {
    return dataset(DatasetLevel.WORKSPACE, owner, name);
  }

  public String mountPath(String dataset) {
    return "/" + dataset;
  }

  /**
   * Owners become a single dataset path component: no slash, no whitespace, no {@code @} snapshot
   * separator, and not {@code .} or {@code ..}.
   */
  public static boolean isValidOwnerSegment(String owner) {
    return owner != null
        && !owner.isEmpty()
        && !owner.equals(".")
        && !owner.equals("..")
        && owner.chars().noneMatch(c -> c == '/' || c == '@' || Character.isWhitespace(c));
  }
}
