package com.querygen.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Path and full source text of a query file.
 *
 * One instance per module, shared by reference by every error raised for that module.
 */
@Value
public class ModuleInfo {
    @NonNull
    String path;
    @NonNull
    String sourceText;
}
