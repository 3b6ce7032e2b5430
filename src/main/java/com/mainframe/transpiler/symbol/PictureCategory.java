package com.mainframe.transpiler.symbol;

public enum PictureCategory {
    NUMERIC,
    NUMERIC_EDITED,
    ALPHANUMERIC,
    ALPHABETIC,
    ALPHANUMERIC_EDITED
}
