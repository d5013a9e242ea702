package io.auditforge.storage;

import io.auditforge.model.Phase;
import io.auditforge.model.PhaseStatus;

public final class PhasePrerequisiteException extends InvalidTransitionException {
    private final Phase missingPrerequisite;
    private final PhaseStatus prerequisiteStatus;

    public PhasePrerequisiteException(Phase phase, PhaseStatus from, Phase missingPrerequisite, PhaseStatus prerequisiteStatus) {
        super(phase, from, PhaseStatus.IN_PROGRESS,
                "Cannot start phase " + phase.dirName() + ": prerequisite phase "
                        + missingPrerequisite.dirName() + " is " + prerequisiteStatus + ", expected COMPLETE");
        this.missingPrerequisite = missingPrerequisite;
        this.prerequisiteStatus = prerequisiteStatus;
    }

    public Phase missingPrerequisite() {
        return missingPrerequisite;
    }

    public PhaseStatus prerequisiteStatus() {
        return prerequisiteStatus;
    }
}
