package io.github.randomcodespace.appliance.builder;

import io.github.randomcodespace.appliance.dto.ContainerSpec;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Default {@link SpecBuilder}. Produces an expression of the form
 *
 * <pre>
 * let
 *   mkContainer = import /var/lib/appliance/nix/mkContainer.nix;
 *   spec = {
 *     name = "dev";
 *     owner = "123";
 *     modules = [ "git" "fish" ];
 *   };
 * in
 *   mkContainer spec
 * </pre>
 *
 * The workspace path and enrollment token are only emitted when present.
 */
public class NixExpressionGenerator implements SpecBuilder {

  @Override
  public String build(ContainerSpec spec, Path flakePath) {
    Path mkContainer = flakePath.resolve("nix").resolve("mkContainer.nix");

    StringBuilder fields = new StringBuilder();
    fields.append("    name = ").append(nixString(spec.getName())).append(";\n");
    fields.append("    owner = ").append(nixString(spec.getOwner())).append(";\n");
    fields.append("    modules = ").append(nixList(spec.getModules())).append(";\n");
    spec.getWorkspacePath()
        .ifPresent(path -> fields.append("    workspace = ").append(nixString(path)).append(";\n"));
    spec.getEnrollmentToken()
        .ifPresent(
            token ->
                fields.append("    tailscaleAuthKey = ").append(nixString(token)).append(";\n"));

    return "let\n"
        + "  mkContainer = import "
        + mkContainer
        + ";\n"
        + "  spec = {\n"
        + fields
        + "  };\n"
        + "in\n"
        + "  mkContainer spec\n";
  }

  // Backslash first so later escapes are not doubled; escaping $ blocks interpolation.
  static String nixString(String value) {
    String escaped = value.replace("\\", "\\\\").replace("\"", "\\\"").replace("$", "\\$");
    return "\"" + escaped + "\"";
  }

  static String nixList(List<String> items) {
    return items.stream()
        .map(NixExpressionGenerator::nixString)
        .collect(Collectors.joining(" ", "[ ", " ]"));
  }
}
