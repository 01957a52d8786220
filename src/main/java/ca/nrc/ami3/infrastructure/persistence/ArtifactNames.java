package ca.nrc.ami3.infrastructure.persistence;

import ca.nrc.ami3.validation.Strings;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic artifact naming: {@code <baseName>_<suffix>.json}.
 *
 * <p>Base names derive only from the exposure reference or output name they are given. Distinct references
 * can share a base name ({@code a/x_cal.fits} and {@code b/x_calints.fits}); the pipeline rejects such
 * associations before anything is written.</p>
 *
 * @since 0.1.0
 */
public final class ArtifactNames {
  /** Extension of every persisted product. */
  public static final String EXTENSION = ".json";

  private static final List<String> KNOWN_EXTENSIONS = List.of(".json", ".fits");
  private static final List<String> PIPELINE_SUFFIXES = List.of("_calints", "_rateints", "_cal", "_rate");

  private ArtifactNames() {
    // Utility
  }

  /**
   * Derives the base name of an exposure reference.
   *
   * <p>Drops directories, a {@code .json} or {@code .fits} extension and one trailing pipeline suffix
   * ({@code _cal}, {@code _calints}, {@code _rate}, {@code _rateints}). Other names pass through.</p>
   *
   * @param reference exposure path or bare name; must not be blank
   * @return base name
   * @throws IllegalArgumentException if nothing usable remains
   */
  public static String memberBaseName(String reference) {
    String name = Strings.requireNonBlank("reference", reference).replace('\\', '/');
    int slash = name.lastIndexOf('/');
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    String lower = name.toLowerCase(Locale.ROOT);
    for (String extension : KNOWN_EXTENSIONS) {
      if (lower.endsWith(extension)) {
        name = name.substring(0, name.length() - extension.length());
        lower = lower.substring(0, lower.length() - extension.length());
        break;
      }
    }
    for (String suffix : PIPELINE_SUFFIXES) {
      if (lower.endsWith(suffix) && name.length() > suffix.length()) {
        name = name.substring(0, name.length() - suffix.length());
        break;
      }
    }
    return Strings.requireNonBlank("reference base name", name);
  }

  /**
   * Builds the artifact file name.
   *
   * @param baseName exposure reference or output name
   * @param suffix product suffix
   * @return file name such as {@code jw01_nis_ami.json}
   * @throws IllegalArgumentException if either component contains characters unsafe in a file name
   */
  public static String fileName(String baseName, String suffix) {
    String base = Strings.requireFileNameComponent("baseName", memberBaseName(baseName));
    String tag = Strings.requireFileNameComponent("suffix", suffix);
    return base + "_" + tag + EXTENSION;
  }
}
