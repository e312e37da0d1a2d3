package deskgate.core.service.upload.stage;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Refuses Windows PE executables ({@code MZ}) whatever type was declared.
 */
public final class ExecutableHeaderStage implements UploadStage {

    private static final byte[] PE_HEADER = {0x4D, 0x5A};

    @Override
    public ValidationVerdict inspect(UploadCandidate candidate, int filesInRequest) {
        if (candidate.startsWith(PE_HEADER)) {
            return ValidationVerdict.reject(RejectionReason.EXECUTABLE_REJECTED, "Executable files are not allowed");
        }
        return ValidationVerdict.accept();
    }

    @Override
    public String name() {
        return "executable-header";
    }
}
