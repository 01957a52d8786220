package ca.nrc.ami3.infrastructure.blend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.nrc.ami3.application.port.BlendException;
import ca.nrc.ami3.application.port.BlendInput;
import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.AsnProvenance;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.domain.model.ProductKind;
import ca.nrc.ami3.infrastructure.persistence.JsonProductPersister;
import ca.nrc.ami3.testutil.Products;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AttributeMetadataBlenderTest {
  private static final AsnProvenance ASN = new AsnProvenance("a3001", "pool", "a3001_ami3_asn.json");

  @TempDir Path tempDir;

  private final AttributeMetadataBlender blender = new AttributeMetadataBlender();

  @Test
  void copiesCommonAttributesAndRecordsDifferingOnes() throws Exception {
    JsonProductPersister persister = new JsonProductPersister(tempDir);
    ArtifactRef a = persist(persister, "sci1", Map.of("filter", "F480M", "target", "AB Dor", "nints", "10"));
    ArtifactRef b = persist(persister, "sci2", Map.of("filter", "F480M", "target", "AB Dor", "nints", "12"));
    DataProduct target = stamped(Products.product(ProductKind.FRINGE_AVERAGE, Map.of("ninputs", "2")));

    blender.blend(target, BlendInput.ofArtifacts(List.of(a, b)));

    Map<String, String> attributes = target.meta().attributes();
    assertEquals("F480M", attributes.get("filter"));
    assertEquals("AB Dor", attributes.get("target"));
    assertEquals("2", attributes.get("ninputs"));
    assertFalse(attributes.containsKey("nints"));
    assertEquals("10,12", attributes.get(AttributeMetadataBlender.BLEND_PREFIX + "nints"));
    assertEquals(List.of("sci1_ami.json", "sci2_ami.json"), target.meta().provenanceInputs());
  }

  @Test
  void attributeMissingFromOneInputIsNotCommon() throws Exception {
    DataProduct science = stamped(Products.product(ProductKind.FRINGE_AVERAGE, Map.of("filter", "F480M")));
    DataProduct reference = stamped(Products.product(ProductKind.FRINGE_AVERAGE, Map.of()));
    DataProduct target = stamped(Products.product(ProductKind.FRINGE_NORMALIZED, Map.of()));

    blender.blend(target, List.of(BlendInput.of(science), BlendInput.of(reference)));

    assertFalse(target.meta().attribute("filter").isPresent());
    assertEquals("F480M", target.meta().attribute("blend.filter").orElseThrow());
    assertEquals(
        List.of("fringe-average[a3001]", "fringe-average[a3001]"), target.meta().provenanceInputs());
  }

  @Test
  void targetAttributesAreNotOverwrittenByCommonValues() throws Exception {
    DataProduct input = stamped(Products.product(ProductKind.FRINGE_FIT, Map.of("ninputs", "1")));
    DataProduct target = stamped(Products.product(ProductKind.FRINGE_AVERAGE, Map.of("ninputs", "2")));

    blender.blend(target, List.of(BlendInput.of(input)));

    assertEquals("2", target.meta().attribute("ninputs").orElseThrow());
  }

  @Test
  void inputFromAnotherAssociationIsRejected() {
    DataProduct foreign = Products.product(ProductKind.FRINGE_FIT, Map.of());
    foreign.meta().asn(new AsnProvenance("a9999", "pool", "other_asn.json"));
    DataProduct target = stamped(Products.product(ProductKind.FRINGE_AVERAGE, Map.of()));

    BlendException ex = assertThrows(BlendException.class,
        () -> blender.blend(target, List.of(BlendInput.of(foreign))));
    assertTrue(ex.getMessage().contains("a9999"));
    assertTrue(target.meta().provenanceInputs().isEmpty());
  }

  @Test
  void emptyInputsAreRejected() {
    DataProduct target = stamped(Products.product(ProductKind.FRINGE_AVERAGE, Map.of()));

    assertThrows(BlendException.class, () -> blender.blend(target, List.of()));
  }

  @Test
  void unreadableArtifactIsABlendFailure() {
    DataProduct target = stamped(Products.product(ProductKind.FRINGE_AVERAGE, Map.of()));
    ArtifactRef missing = new ArtifactRef(tempDir.resolve("missing_ami.json"));

    assertThrows(BlendException.class, () -> blender.blend(target, List.of(BlendInput.of(missing))));
  }

  private static ArtifactRef persist(JsonProductPersister persister, String base, Map<String, String> attributes)
      throws Exception {
    try (DataProduct product = stamped(Products.product(ProductKind.FRINGE_FIT, attributes))) {
      return persister.save(product, base, "ami", ASN.asnId());
    }
  }

  private static DataProduct stamped(DataProduct product) {
    product.meta().asn(ASN);
    return product;
  }
}
