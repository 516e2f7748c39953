package com.jumbo.companion.service.governor;

public interface MemoryProbe {

    long usedBytes();

    long maxBytes();
}
