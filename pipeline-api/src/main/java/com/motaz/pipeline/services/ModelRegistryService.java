package com.motaz.pipeline.services;

import com.motaz.pipeline.analysis.ModelArtifact;
import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.model.entities.ModelRegistryEntity;
import com.motaz.pipeline.repositories.ModelRegistryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    private final ModelRegistryRepository modelRegistryRepository;

    @Transactional
    public Long save(ModelArtifact artifact, String notes) throws IOException {
        AnalysisConfig config = artifact.getConfig();
        String schema = "window" + artifact.getWindowSchema() + ";event" + artifact.getEventSchema();

        ModelRegistryEntity entity = new ModelRegistryEntity();
        entity.setKernel(config.getKernel().label());
        entity.setNu(config.getNu());
        entity.setGamma(config.getGamma().toString());
        entity.setWindowSize(config.getWindowSize());
        entity.setClusters(config.getClusters());
        entity.setLinkage(config.getLinkage().label());
        entity.setFeatureSchema(schema);
        entity.setSchemaHash(Integer.toHexString(schema.hashCode()));
        entity.setTrainedRows((long) artifact.getNovelty().getTrainedRows());
        entity.setNotes(notes);
        entity.setModelBytes(artifact.toBytes());
        ModelRegistryEntity saved = modelRegistryRepository.save(entity);
        log.info("Stored model {} ({} bytes, {} training windows)", saved.getId(),
                saved.getModelBytes().length, saved.getTrainedRows());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public Optional<ModelArtifact> loadLatest() throws IOException, ClassNotFoundException {
        Optional<ModelRegistryEntity> latest = modelRegistryRepository.findLatestModel();
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ModelArtifact.fromBytes(latest.get().getModelBytes()));
    }
}
