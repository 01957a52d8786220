package ca.nrc.ami3.infrastructure.persistence;

import ca.nrc.ami3.application.port.PersistException;
import ca.nrc.ami3.application.port.ProductPersister;
import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.AsnProvenance;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.domain.model.FringeObservables;
import ca.nrc.ami3.domain.model.ProductMeta;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProductPersister} writing products as pretty-printed JSON documents.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Name artifacts {@code <baseName>_<suffix>.json} inside the output directory.</li>
 *   <li>Write to a temporary sibling then move it into place atomically.</li>
 *   <li>Record the written file name on the product so later blending can reference it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent saves of distinct names; shares only the immutable
 * {@link JsonFactory}.</p>
 * <p><strong>Determinism:</strong> Documents contain no timestamps; saving equal products twice yields
 * byte-identical files.</p>
 *
 * @since 0.1.0
 */
public final class JsonProductPersister implements ProductPersister {
  private static final Logger log = LoggerFactory.getLogger(JsonProductPersister.class);

  private final Path outputDirectory;
  private final JsonFactory factory;

  public JsonProductPersister(Path outputDirectory) {
    this(outputDirectory, new JsonFactory());
  }

  public JsonProductPersister(Path outputDirectory, JsonFactory factory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public Path outputDirectory() {
    return outputDirectory;
  }

  @Override
  public ArtifactRef save(DataProduct product, String baseName, String suffix, String asnId)
      throws PersistException {
    Objects.requireNonNull(product, "product");
    String fileName = artifactName(baseName, suffix);
    Path target = outputDirectory.resolve(fileName);
    Path tmp = null;
    try {
      Files.createDirectories(outputDirectory);
      tmp = Files.createTempFile(outputDirectory, fileName, ".tmp");
      try (OutputStream out = Files.newOutputStream(tmp);
           JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
        gen.useDefaultPrettyPrinter();
        write(gen, product, asnId);
      }
      move(tmp, target);
    } catch (IOException | RuntimeException ex) {
      PersistException failure = new PersistException("Failed to write " + target, ex);
      deleteQuietly(tmp, failure);
      throw failure;
    }
    product.meta().fileName(fileName);
    log.debug("Wrote {} ({})", target, product.kind().wireName());
    return new ArtifactRef(target);
  }

  @Override
  public String artifactName(String baseName, String suffix) throws PersistException {
    try {
      return ArtifactNames.fileName(baseName, suffix);
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new PersistException("Invalid artifact name for " + baseName + " / " + suffix, ex);
    }
  }

  private static void move(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", target);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path tmp, PersistException failure) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException cleanup) {
      failure.addSuppressed(cleanup);
    }
  }

  private static void write(JsonGenerator gen, DataProduct product, String asnId) throws IOException {
    ProductMeta meta = product.meta();
    AsnProvenance asn = meta.asn();
    gen.writeStartObject();
    gen.writeStringField(ProductJson.KIND, product.kind().wireName());

    gen.writeObjectFieldStart(ProductJson.ASN);
    gen.writeStringField(ProductJson.ASN_ID, asnId == null || asnId.isBlank() ? asn.asnId() : asnId);
    gen.writeStringField(ProductJson.POOL_NAME, asn.poolName());
    gen.writeStringField(ProductJson.TABLE_NAME, asn.tableName());
    gen.writeEndObject();

    gen.writeObjectFieldStart(ProductJson.ATTRIBUTES);
    for (Map.Entry<String, String> entry : meta.attributes().entrySet()) {
      gen.writeStringField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();

    gen.writeArrayFieldStart(ProductJson.PROVENANCE);
    for (String input : meta.provenanceInputs()) {
      gen.writeString(input);
    }
    gen.writeEndArray();

    FringeObservables obs = product.observables();
    gen.writeObjectFieldStart(ProductJson.OBSERVABLES);
    gen.writeNumberField(ProductJson.HOLES, obs.holes());
    writeArray(gen, ProductJson.AMPLITUDES, obs.amplitudes());
    writeArray(gen, ProductJson.PHASES, obs.phases());
    writeArray(gen, ProductJson.CLOSURE_PHASES, obs.closurePhases());
    if (obs.hasErrors()) {
      writeArray(gen, ProductJson.AMPLITUDE_ERRORS, obs.amplitudeErrors());
      writeArray(gen, ProductJson.PHASE_ERRORS, obs.phaseErrors());
      writeArray(gen, ProductJson.CLOSURE_PHASE_ERRORS, obs.closurePhaseErrors());
    }
    gen.writeEndObject();

    gen.writeEndObject();
  }

  private static void writeArray(JsonGenerator gen, String field, double[] values) throws IOException {
    gen.writeArrayFieldStart(field);
    for (double value : values) {
      if (!Double.isFinite(value)) {
        throw new IOException("Non-finite value in " + field);
      }
      gen.writeNumber(value);
    }
    gen.writeEndArray();
  }
}
