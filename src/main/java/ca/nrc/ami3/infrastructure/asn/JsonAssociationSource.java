package ca.nrc.ami3.infrastructure.asn;

import ca.nrc.ami3.application.port.AssociationLoadException;
import ca.nrc.ami3.application.port.AssociationSource;
import ca.nrc.ami3.domain.asn.Association;
import ca.nrc.ami3.domain.asn.AssociationMember;
import ca.nrc.ami3.domain.asn.AssociationProduct;
import ca.nrc.ami3.domain.asn.MemberRole;
import ca.nrc.ami3.infrastructure.json.JsonSupport;
import ca.nrc.ami3.infrastructure.persistence.ArtifactNames;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads level-3 association tables written as JSON.
 * <p><strong>Format:</strong>
 * <pre>{@code
 * {"asn_id": "...", "asn_pool": "...",
 *  "products": [{"name": "...", "members": [{"expname": "...", "exptype": "science"}]}]}
 * }</pre>
 * Member {@code expname} values resolve against the association file's directory. The table name recorded
 * for provenance is the association file name.</p>
 * <p><strong>Singleton mode:</strong> an exposure document (one carrying {@code integrations} and no
 * {@code products}) is wrapped as a one-member science association with id {@value #SINGLETON_ID}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonSupport}; safe for concurrent
 * use.</p>
 *
 * @since 0.1.0
 */
public final class JsonAssociationSource implements AssociationSource {
  private static final Logger log = LoggerFactory.getLogger(JsonAssociationSource.class);

  /** Association id assigned to a single exposure loaded as an association. */
  public static final String SINGLETON_ID = "singleton";

  private final JsonSupport json;

  public JsonAssociationSource() {
    this(new JsonSupport());
  }

  public JsonAssociationSource(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public Association load(Path input) throws AssociationLoadException {
    Objects.requireNonNull(input, "input");
    Path file = input.toAbsolutePath().normalize();
    if (!Files.isRegularFile(file)) {
      throw new AssociationLoadException("Association input not found: " + file);
    }
    try {
      Map<String, Object> root = JsonSupport.asObject(json.parse(file), "association document");
      if (root.containsKey("products")) {
        return readAssociation(root, file);
      }
      if (root.containsKey("integrations")) {
        log.info("Input {} is a single exposure; loading it as a singleton association", file.getFileName());
        return singleton(file);
      }
      throw new AssociationLoadException(
          "Input " + file + " is neither an association (no 'products') nor an exposure (no 'integrations')");
    } catch (IOException ex) {
      throw new AssociationLoadException("Unable to read association " + file, ex);
    } catch (IllegalArgumentException ex) {
      throw new AssociationLoadException("Malformed association " + file + ": " + ex.getMessage(), ex);
    }
  }

  private static Association readAssociation(Map<String, Object> root, Path file) {
    String id = JsonSupport.requireString(root, "asn_id");
    String pool = JsonSupport.optionalString(root, "asn_pool", "");
    Path baseDir = file.getParent();
    List<AssociationProduct> products = new ArrayList<>();
    List<Object> rawProducts = JsonSupport.asArray(root.get("products"), "products");
    for (int p = 0; p < rawProducts.size(); p++) {
      Map<String, Object> rawProduct = JsonSupport.asObject(rawProducts.get(p), "products[" + p + "]");
      Optional<String> name = Optional.ofNullable(JsonSupport.optionalString(rawProduct, "name", null));
      List<AssociationMember> members = new ArrayList<>();
      List<Object> rawMembers =
          JsonSupport.asArray(rawProduct.getOrDefault("members", List.of()), "products[" + p + "].members");
      for (int m = 0; m < rawMembers.size(); m++) {
        Map<String, Object> rawMember =
            JsonSupport.asObject(rawMembers.get(m), "products[" + p + "].members[" + m + "]");
        String expname = JsonSupport.requireString(rawMember, "expname");
        String exptype = JsonSupport.optionalString(rawMember, "exptype", null);
        members.add(AssociationMember.of(resolve(baseDir, expname), exptype));
      }
      products.add(new AssociationProduct(name, members));
    }
    return new Association(id, pool, file.getFileName().toString(), products);
  }

  private static Association singleton(Path file) {
    String exposure = file.toString();
    AssociationMember member = new AssociationMember(exposure, MemberRole.SCIENCE, "science");
    AssociationProduct product =
        new AssociationProduct(Optional.of(ArtifactNames.memberBaseName(exposure)), List.of(member));
    return new Association(SINGLETON_ID, SINGLETON_ID, file.getFileName().toString(), List.of(product));
  }

  private static String resolve(Path baseDir, String expname) {
    Path candidate = Path.of(expname.trim());
    if (candidate.isAbsolute() || baseDir == null) {
      return candidate.normalize().toString();
    }
    return baseDir.resolve(candidate).normalize().toString();
  }
}
