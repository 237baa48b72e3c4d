package com.querygen.validation.service;

import com.querygen.model.ModuleInfo;
import com.querygen.model.ParsedModule;

import lombok.NonNull;
import lombok.Value;

/**
 * A parsed module paired with the file it came from.
 */
@Value
public class ModuleSource {
    @NonNull
    ModuleInfo moduleInfo;
    @NonNull
    ParsedModule parsedModule;
}
