package com.security.anomaly.repository;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.security.anomaly.model.AnomalyType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorModelRepositoryTest {

    @TempDir
    Path storageRoot;

    private final DetectorModelRepository repository = new DetectorModelRepository();

    private DetectorModelEnvelope envelope(String name) {
        return DetectorModelEnvelope.builder()
                .schemaVersion(DetectorModelEnvelope.SCHEMA_VERSION)
                .detectorName(name)
                .anomalyType(AnomalyType.ACCESS_TIME)
                .savedAt(Instant.parse("2026-03-14T12:00:00Z"))
                .lastTrainingTime(Instant.parse("2026-03-14T11:00:00Z"))
                .baselineEstablished(true)
                .state(repository.toTree(Map.of("userProfiles", Map.of("alice", Map.of("9", 4)))))
                .build();
    }

    @Test
    void save_thenLoad_returnsSameEnvelope() throws IOException {
        repository.save(storageRoot, envelope("access_time_detector"));

        Optional<DetectorModelEnvelope> loaded = repository.load(storageRoot, "access_time_detector");

        assertThat(loaded).isPresent();
        assertThat(loaded.get()).isEqualTo(envelope("access_time_detector"));
        assertThat(repository.modelPath(storageRoot, "access_time_detector"))
                .isEqualTo(storageRoot.resolve("models").resolve("access_time_detector.json"));
    }

    @Test
    void save_leavesNoTempFilesBehind() throws IOException {
        repository.save(storageRoot, envelope("access_time_detector"));
        repository.save(storageRoot, envelope("access_time_detector"));

        try (Stream<Path> files = Files.list(storageRoot.resolve("models"))) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly("access_time_detector.json");
        }
    }

    @Test
    void load_missingModel_returnsEmpty() throws IOException {
        assertThat(repository.load(storageRoot, "geo_location_detector")).isEmpty();
    }

    @Test
    void load_fileOfAnotherDetector_throws() throws IOException {
        repository.save(storageRoot, envelope("access_time_detector"));
        Path path = repository.modelPath(storageRoot, "access_time_detector");
        Files.copy(path, repository.modelPath(storageRoot, "geo_location_detector"));

        assertThatThrownBy(() -> repository.load(storageRoot, "geo_location_detector"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("belongs to detector access_time_detector");
    }

    @Test
    void load_unknownSchemaVersion_throws() throws IOException {
        DetectorModelEnvelope future = envelope("access_time_detector");
        future.setSchemaVersion(DetectorModelEnvelope.SCHEMA_VERSION + 1);
        repository.save(storageRoot, future);

        assertThatThrownBy(() -> repository.load(storageRoot, "access_time_detector"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("schema version");
    }

    @Test
    void load_missingState_throws() throws IOException {
        DetectorModelEnvelope empty = envelope("access_time_detector");
        empty.setState(JsonNodeFactory.instance.nullNode());
        repository.save(storageRoot, empty);

        assertThatThrownBy(() -> repository.load(storageRoot, "access_time_detector"))
                .isInstanceOf(IOException.class);
    }

    @Test
    void load_corruptFile_throws() throws IOException {
        Path path = repository.modelPath(storageRoot, "access_time_detector");
        Files.createDirectories(path.getParent());
        Files.writeString(path, "{ not json");

        assertThatThrownBy(() -> repository.load(storageRoot, "access_time_detector"))
                .isInstanceOf(IOException.class);
    }
}
