package com.terradrift.core.error;

import java.nio.file.Path;

/**
 * A Terraform state file or definition file could not be read or parsed.
 */
public class DefinitionParseException extends DriftException {

    private final Path source;

    public DefinitionParseException(Path source, String message) {
        super(ErrorKind.PARSE, message);
        this.source = source;
    }

    public DefinitionParseException(Path source, String message, Throwable cause) {
        super(ErrorKind.PARSE, message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
