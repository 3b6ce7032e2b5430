package com.mainframe.transpiler.symbol;

import com.mainframe.transpiler.diagnostics.TranspilerException;

/**
 * Raised by {@link PictureClause#parse(String)} for a character string that is not a valid picture.
 */
public class InvalidPictureException extends TranspilerException {

    public InvalidPictureException(String picture, String reason) {
        super("Invalid PICTURE '" + picture + "': " + reason);
    }
}
