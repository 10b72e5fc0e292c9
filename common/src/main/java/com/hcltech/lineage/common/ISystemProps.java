package com.hcltech.lineage.common;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

public interface ISystemProps {
    @Nullable
    String getProperty(String key);

    static ISystemProps mock(Map<String, String> map) {
        return map::get;
    }

    ISystemProps real = System::getProperty;
}
