package io.github.randomcodespace.appliance.enums;

/** Why a lifecycle call failed. Timeouts are not listed; they surface as exceptions. */
public enum FailureKind {
  VALIDATION, // rejected before any side effect
  PROVISIONING, // storage hierarchy operation failed, build tool never ran
  BUILD_FAILURE, // declarative build/install never reached the start step
  PARTIAL_INSTALL, // installed but failed to start, storage kept
  DESTROY_FAILURE, // teardown tool failed, storage untouched
  START_FAILURE,
  STOP_FAILURE
}
