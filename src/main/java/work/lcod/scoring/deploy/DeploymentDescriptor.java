package work.lcod.scoring.deploy;

import java.nio.file.Path;
import java.util.Objects;
import work.lcod.scoring.api.OutputNames;
import work.lcod.scoring.model.ImputationTable;

/**
 * Everything generated for one model deployment: where the artifact lives, which module and routine it is
 * published as, the output field names and the frozen imputation table.
 */
public record DeploymentDescriptor(
    String moduleId,
    String routineName,
    Path artifact,
    OutputNames outputNames,
    ImputationTable imputationTable
) {
    public DeploymentDescriptor {
        if (moduleId == null || moduleId.isBlank()) {
            throw new IllegalArgumentException("Deployment module id is required");
        }
        if (routineName == null || routineName.isBlank()) {
            throw new IllegalArgumentException("Deployment routine name is required");
        }
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(outputNames, "outputNames");
        Objects.requireNonNull(imputationTable, "imputationTable");
    }

    public DeploymentDescriptor withArtifact(Path newArtifact) {
        return new DeploymentDescriptor(moduleId, routineName, newArtifact, outputNames, imputationTable);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String moduleId;
        private String routineName;
        private Path artifact;
        private OutputNames outputNames = OutputNames.DEFAULT;
        private ImputationTable imputationTable;

        public Builder moduleId(String moduleId) {
            this.moduleId = moduleId;
            return this;
        }

        public Builder routineName(String routineName) {
            this.routineName = routineName;
            return this;
        }

        public Builder artifact(Path artifact) {
            this.artifact = artifact;
            return this;
        }

        public Builder outputNames(OutputNames outputNames) {
            this.outputNames = outputNames;
            return this;
        }

        public Builder imputationTable(ImputationTable imputationTable) {
            this.imputationTable = imputationTable;
            return this;
        }

        public DeploymentDescriptor build() {
            return new DeploymentDescriptor(moduleId, routineName, artifact, outputNames, imputationTable);
        }
    }
}
