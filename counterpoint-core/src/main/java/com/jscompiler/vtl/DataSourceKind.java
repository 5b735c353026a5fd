package com.jscompiler.vtl;

public enum DataSourceKind {
    NONE,
    KEY_VALUE_STORE,
    COMPUTE_FUNCTION,
    HTTP
}
