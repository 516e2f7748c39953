package com.jumbo.companion.service.governor;

import org.springframework.stereotype.Component;

@Component
public class RuntimeMemoryProbe implements MemoryProbe {

    @Override
    public long usedBytes() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }

    @Override
    public long maxBytes() {
        return Runtime.getRuntime().maxMemory();
    }
}
