package com.jscompiler.fold;

import com.jscompiler.CompilationException;
import com.jscompiler.ErrorKind;

import java.util.stream.Collectors;

/**
 * Validates the references an event input transform may keep after flattening.
 */
public final class EventReferences {

    private EventReferences() {
    }

    /**
     * Accepts a reference rooted at the event parameter, where anything deeper than
     * one level must go through {@code detail}, or rooted at the utilities parameter.
     *
     * @throws CompilationException of kind {@link ErrorKind#INVALID_REFERENCE} otherwise
     */
    public static void assertValidEventReference(ReferencePath path, String eventName, String utilsName) {
        if (path == null) {
            throw new CompilationException(ErrorKind.INVALID_REFERENCE, "a valid event reference was not provided");
        }
        if (path.identity().equals(eventName)) {
            if (path.depth() > 1 && !"detail".equals(path.reference().get(0))) {
                throw new CompilationException(ErrorKind.INVALID_REFERENCE,
                    "event references deeper than one level must be on the detail property, got "
                        + path.reference().stream().map(String::valueOf).collect(Collectors.joining(",")));
            }
        } else if (utilsName == null || !path.identity().equals(utilsName)) {
            throw new CompilationException(ErrorKind.INVALID_REFERENCE,
                "unresolved references can only reference the event parameter (" + eventName
                    + ") or the utilities parameter (" + utilsName + "), but found " + path.identity());
        }
    }
}
