package com.arriraw.core;

import lombok.Getter;

import java.util.Locale;

/**
 * The nine metadata blocks of the header, in processing order.
 */
public enum BlockKind {
    IDI("Image Data Info"),
    ICI("Image Content Info"),
    CDI("Camera Device Info"),
    LDI("Lens Device Info"),
    VFX("Visual Effects Info"),
    CID("Clip Identification"),
    SID("Sound Identification"),
    FLI("Frame Line Info"),
    NRI("Noise Reduction Info");

    @Getter
    private final String description;

    BlockKind(String description) {
        this.description = description;
    }

    /**
     * Classpath location of the canonical catalog for this block.
     */
    public String getResourceName() {
        return "/catalogs/" + name().toLowerCase(Locale.ROOT) + ".json";
    }
}
