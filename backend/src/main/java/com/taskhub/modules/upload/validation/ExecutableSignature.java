package com.taskhub.modules.upload.validation;

/**
 * Native executable headers. A file starting with any of these is rejected in
 * every validation profile.
 */
public enum ExecutableSignature {
    PE("PE executable", 0x4D, 0x5A),
    ELF("ELF executable", 0x7F, 0x45, 0x4C, 0x46),
    MACH_O_32("Mach-O executable", 0xFE, 0xED, 0xFA, 0xCE),
    MACH_O_64("Mach-O executable", 0xFE, 0xED, 0xFA, 0xCF),
    MACH_O_32_LE("Mach-O executable", 0xCE, 0xFA, 0xED, 0xFE),
    MACH_O_64_LE("Mach-O executable", 0xCF, 0xFA, 0xED, 0xFE);

    private final String description;
    private final byte[] magic;

    ExecutableSignature(String description, int... magic) {
        this.description = description;
        this.magic = new byte[magic.length];
        for (int i = 0; i < magic.length; i++) {
            this.magic[i] = (byte) magic[i];
        }
    }

    public String getDescription() {
        return description;
    }

    public boolean matches(byte[] header) {
        if (header == null || header.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (header[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
