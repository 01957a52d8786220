package ca.nrc.ami3.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Writes exposure and association documents for tests that run the real JSON adapters. */
public final class ExposureFixtures {
  private ExposureFixtures() {}

  /**
   * Writes a 3-hole exposure whose baselines all carry the same complex visibility.
   *
   * @param dir target directory
   * @param fileName exposure file name
   * @param filter value of the {@code filter} meta attribute
   * @param amplitude visibility amplitude on every baseline
   * @param phasesDeg phase per baseline in degrees (three values)
   * @param integrations number of identical integrations
   * @return written file
   */
  public static Path writeExposure(
      Path dir, String fileName, String filter, double amplitude, double[] phasesDeg, int integrations)
      throws IOException {
    StringBuilder json = new StringBuilder();
    json.append("{\n  \"meta\": {\"filter\": \"").append(filter).append("\", \"pupil\": \"NRM\", \"exposure\": \"")
        .append(fileName).append("\"},\n  \"holes\": 3,\n  \"integrations\": [");
    for (int n = 0; n < integrations; n++) {
      json.append(n == 0 ? "\n    [" : ",\n    [");
      for (int b = 0; b < phasesDeg.length; b++) {
        double radians = Math.toRadians(phasesDeg[b]);
        json.append(b == 0 ? "" : ", ")
            .append(String.format(Locale.ROOT, "[%.12f, %.12f]",
                amplitude * Math.cos(radians), amplitude * Math.sin(radians)));
      }
      json.append("]");
    }
    json.append("\n  ]\n}\n");
    Path file = dir.resolve(fileName);
    Files.writeString(file, json.toString(), StandardCharsets.UTF_8);
    return file;
  }

  public static Path writeExposure(Path dir, String fileName, double amplitude, double[] phasesDeg)
      throws IOException {
    return writeExposure(dir, fileName, "F480M", amplitude, phasesDeg, 2);
  }

  /**
   * Writes an association with one product.
   *
   * @param dir target directory; member names are written as given (relative names resolve against it)
   * @param asnId association id
   * @param productName product name, or {@code null} to omit it
   * @param members alternating {@code expname, exptype} pairs
   * @return written association file
   */
  public static Path writeAssociation(Path dir, String asnId, String productName, String... members)
      throws IOException {
    List<String> entries = new ArrayList<>();
    for (int i = 0; i + 1 < members.length; i += 2) {
      entries.add("        {\"expname\": \"" + members[i] + "\", \"exptype\": \"" + members[i + 1] + "\"}");
    }
    String name = productName == null ? "" : "      \"name\": \"" + productName + "\",\n";
    String json = "{\n"
        + "  \"asn_id\": \"" + asnId + "\",\n"
        + "  \"asn_pool\": \"jw00001_20261018t000000_pool\",\n"
        + "  \"products\": [\n"
        + "    {\n"
        + name
        + "      \"members\": [\n"
        + String.join(",\n", entries) + "\n"
        + "      ]\n"
        + "    }\n"
        + "  ]\n"
        + "}\n";
    Path file = dir.resolve(asnId + "_ami3_asn.json");
    Files.writeString(file, json, StandardCharsets.UTF_8);
    return file;
  }
}
