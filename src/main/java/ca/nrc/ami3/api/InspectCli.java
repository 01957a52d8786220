package ca.nrc.ami3.api;

import ca.nrc.ami3.application.pipeline.PhasePlan;
import ca.nrc.ami3.application.port.AssociationLoadException;
import ca.nrc.ami3.config.DefaultsForMode;
import ca.nrc.ami3.domain.asn.Association;
import ca.nrc.ami3.domain.asn.AssociationMember;
import ca.nrc.ami3.domain.asn.AssociationProduct;
import ca.nrc.ami3.domain.asn.MemberRole;
import ca.nrc.ami3.infrastructure.asn.JsonAssociationSource;
import ca.nrc.ami3.infrastructure.json.JsonSupport;
import ca.nrc.ami3.logging.LoggingConfigurator;
import ca.nrc.ami3.validation.Paths;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads an association and prints its members grouped by role together with the phase plan.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String SUMMARY_USAGE = "usage: inspect in=PATH [config=FILE]";
  private static final String HELP_TEXT = """
      AMI3 association inspector

      Usage:
        inspect in=./jw00001-a3001_ami3_asn.json

      Required:
        in=PATH      Association table (JSON) or a single exposure

      Optional:
        config=FILE  YAML file; the 'common' and 'inspect' sections apply
        --verbose    Enable DEBUG logging
        --help       Show this message
      """;

  private InspectCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path in;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(DefaultsForMode.INSPECT_MODE, kv, log);
      String raw = effective.getOrDefault("in", effective.get("input"));
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("in is required (association table or exposure)");
      }
      in = Paths.requireReadableFile("in", Path.of(raw.trim()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (UncheckedIOException ex) {
      log.error(ex.getMessage(), ex.getCause());
      return ExitCode.IO_ERROR;
    }

    try {
      Association association = new JsonAssociationSource(new JsonSupport()).load(in);
      CliPrinter.printLines(describe(association, PhasePlan.of(association)).toArray(String[]::new));
      return ExitCode.SUCCESS;
    } catch (AssociationLoadException ex) {
      log.error("Unable to load association from {}: {}", in, ex.getMessage());
      return ExitCode.IO_ERROR;
    }
  }

  static List<String> describe(Association association, PhasePlan plan) {
    List<String> lines = new ArrayList<>();
    lines.add("Association " + association.id());
    lines.add("  Pool: " + association.poolName());
    lines.add("  Table: " + association.tableName());
    lines.add("  Products: " + association.products().size());
    association.primaryProduct().ifPresent(product -> {
      lines.add("  Product name: " + product.name().orElse("(none)"));
      for (MemberRole role : MemberRole.values()) {
        List<AssociationMember> members = membersWithRole(product, role);
        lines.add("  " + role + " (" + members.size() + ")");
        for (AssociationMember member : members) {
          lines.add("    " + member.exposure() + " [" + member.rawTag() + "]");
        }
      }
    });
    lines.add("  Phase plan: " + plan.phases());
    plan.abortReason().ifPresent(reason -> lines.add("  Would abort: " + reason));
    if (plan.degraded()) {
      lines.add("  Normalization: skipped (no reference members)");
    }
    return lines;
  }

  private static List<AssociationMember> membersWithRole(AssociationProduct product, MemberRole role) {
    List<AssociationMember> matching = new ArrayList<>();
    for (AssociationMember member : product.members()) {
      if (member.role() == role) {
        matching.add(member);
      }
    }
    return matching;
  }
}
