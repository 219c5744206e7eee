package io.kiln.core.expander;

import java.io.Serial;

/// Thrown by an extractor node when the column or field it extracts is absent
/// and no fill value was configured.
///
/// Raised only when the execution engine invokes the node; building the node
/// never predicts it.
public class MissingOutputException extends RuntimeException {

    @Serial private static final long serialVersionUID = -3021188479436015202L;

    public MissingOutputException(String message) {
        super(message);
    }
}
