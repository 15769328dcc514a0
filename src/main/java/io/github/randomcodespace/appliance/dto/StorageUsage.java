package io.github.randomcodespace.appliance.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Quota and usage of an owner's root dataset, in human-readable units. */
@Getter
@Builder
@ToString
public class StorageUsage {
  private final boolean success;
  private final String owner;
  private final String quota;
  private final String used;
  private final String available;
  private final String message;
  private final String error;
}
