package com.motaz.pipeline.analysis;

import com.motaz.pipeline.analysis.clustering.ClusteringResult;
import com.motaz.pipeline.analysis.config.AnalysisConfig;
import com.motaz.pipeline.analysis.model.EventFeatures;
import com.motaz.pipeline.analysis.model.WindowFeatures;
import com.motaz.pipeline.analysis.novelty.NoveltyModelState;
import com.motaz.pipeline.analysis.novelty.OneClassSvmModel;
import lombok.Value;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Trained state of one run: the novelty boundary with its scaler, the clustering configuration and,
 * when events were clustered, the cluster centroids and labels.
 */
@Value
public class ModelArtifact implements Serializable {

    private static final long serialVersionUID = 1L;

    AnalysisConfig config;
    NoveltyModelState novelty;
    ClusteringResult clustering;
    List<String> windowSchema;
    List<String> eventSchema;
    Instant createdAt;

    public static ModelArtifact of(AnalysisConfig config, OneClassSvmModel noveltyModel, ClusteringResult clustering) {
        return new ModelArtifact(config, noveltyModel.state(), clustering,
                WindowFeatures.SCHEMA, EventFeatures.SCHEMA, Instant.now());
    }

    public OneClassSvmModel restoreNoveltyModel() {
        return OneClassSvmModel.restore(novelty, config.getTolerance());
    }

    public Optional<ClusteringResult> clusteringResult() {
        return Optional.ofNullable(clustering);
    }

    public byte[] toBytes() throws IOException {
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream();
             ObjectOutputStream oos = new ObjectOutputStream(bos)) {
            oos.writeObject(this);
            oos.flush();
            return bos.toByteArray();
        }
    }

    public static ModelArtifact fromBytes(byte[] bytes) throws IOException, ClassNotFoundException {
        try (ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            return (ModelArtifact) ois.readObject();
        }
    }
}
