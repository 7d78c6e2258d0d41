package com.ventture.credit.engine.error;

/**
 * Model or schema artifact could not be read or the pair is inconsistent.
 * Fatal at startup; on reload the previously loaded engine stays active.
 */
public class ArtifactLoadException extends CreditEngineException {

    public ArtifactLoadException(String message) {
        super(message);
    }

    public ArtifactLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
