package ai.reanalyze.exception;

import ai.reanalyze.tools.ErrorPayload;
import ai.reanalyze.workspace.UnitId;

public class UnitNotFoundException extends SessionOperationException {
    public UnitNotFoundException(UnitId unitId) {
        super("Compilation unit not found: " + unitId);
    }

    @Override
    public String code() {
        return ErrorPayload.Code.NOT_FOUND;
    }
}
