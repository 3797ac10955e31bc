package com.taskhub.modules.upload.validation;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.util.Optional;

/**
 * Magic-byte sniffing backed by Apache Tika. The filename is passed as a hint
 * so that container formats (docx, xlsx) resolve to their specific type rather
 * than plain zip.
 */
public class TikaMimeSniffer implements MimeSniffer {

    private final Tika tika;

    public TikaMimeSniffer() {
        this(new Tika());
    }

    public TikaMimeSniffer(Tika tika) {
        this.tika = tika;
    }

    @Override
    public Optional<String> detect(byte[] header, String filenameHint) {
        String detected = filenameHint == null ? tika.detect(header) : tika.detect(header, filenameHint);
        MediaType mediaType = MediaType.parse(detected);
        if (mediaType == null) {
            return Optional.of(MediaType.OCTET_STREAM.toString());
        }
        return Optional.of(mediaType.getBaseType().toString());
    }

    @Override
    public boolean inspectsContent() {
        return true;
    }
}
