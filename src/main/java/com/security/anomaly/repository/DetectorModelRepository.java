package com.security.anomaly.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores detector models as JSON files under {@code <storageRoot>/models/<detector>.json}.
 * Writes go to a temp file in the same directory and are moved into place atomically,
 * so a crash mid-write never leaves a truncated model behind.
 */
@Repository
public class DetectorModelRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectorModelRepository.class);

    private final ObjectMapper objectMapper;

    public DetectorModelRepository() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path modelPath(Path storageRoot, String detectorName) {
        return storageRoot.resolve("models").resolve(detectorName + ".json");
    }

    public void save(Path storageRoot, DetectorModelEnvelope envelope) throws IOException {
        Path target = modelPath(storageRoot, envelope.getDetectorName());
        Files.createDirectories(target.getParent());

        Path temp = Files.createTempFile(target.getParent(), envelope.getDetectorName(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), envelope);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        log.debug("Wrote model {} to {}", envelope.getDetectorName(), target);
    }

    /**
     * Read and validate a model file.
     *
     * @return empty when no model has been saved yet
     * @throws IOException when the file is unreadable or belongs to another detector or schema version
     */
    public Optional<DetectorModelEnvelope> load(Path storageRoot, String detectorName) throws IOException {
        Path path = modelPath(storageRoot, detectorName);
        if (!Files.exists(path)) {
            return Optional.empty();
        }

        DetectorModelEnvelope envelope = objectMapper.readValue(path.toFile(), DetectorModelEnvelope.class);
        if (envelope.getSchemaVersion() != DetectorModelEnvelope.SCHEMA_VERSION) {
            throw new IOException("Model " + path + " has schema version " + envelope.getSchemaVersion()
                    + ", expected " + DetectorModelEnvelope.SCHEMA_VERSION);
        }
        if (!detectorName.equals(envelope.getDetectorName())) {
            throw new IOException("Model " + path + " belongs to detector " + envelope.getDetectorName()
                    + ", expected " + detectorName);
        }
        if (envelope.getState() == null || envelope.getState().isNull()) {
            throw new IOException("Model " + path + " has no state");
        }
        return Optional.of(envelope);
    }

    public JsonNode toTree(Object state) {
        return objectMapper.valueToTree(state);
    }

    public <S> S readState(DetectorModelEnvelope envelope, Class<S> stateType) throws IOException {
        try {
            return objectMapper.treeToValue(envelope.getState(), stateType);
        } catch (JsonProcessingException e) {
            throw new IOException("Model state of " + envelope.getDetectorName() + " does not match "
                    + stateType.getSimpleName(), e);
        }
    }
}
