package io.github.randomcodespace.appliance.ownership;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One way of finding out who owns a container. Implementations never fail the returned future for
 * an ordinary "could not tell"; they complete it with {@link Optional#empty()} instead.
 */
public interface OwnerDiscovery {

  /** Short label used in log lines. */
  String name();

  CompletableFuture<Optional<String>> discover(String containerName);
}
