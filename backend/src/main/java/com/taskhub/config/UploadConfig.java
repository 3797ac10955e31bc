package com.taskhub.config;

import com.taskhub.modules.upload.validation.DeclaredTypeMimeSniffer;
import com.taskhub.modules.upload.validation.MimeSniffer;
import com.taskhub.modules.upload.validation.TikaMimeSniffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

import java.time.Clock;

/**
 * Wires the upload pipeline's collaborators that are not plain components.
 */
@Slf4j
@Configuration
public class UploadConfig {

    private static final String TIKA_CLASS = "org.apache.tika.Tika";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Content sniffing when Tika is on the classpath and not switched off,
     * declared-type checks otherwise. Decided once, here.
     */
    @Bean
    public MimeSniffer mimeSniffer(UploadProperties properties) {
        boolean tikaPresent = ClassUtils.isPresent(TIKA_CLASS, getClass().getClassLoader());
        if (properties.isContentSniffing() && tikaPresent) {
            log.info("MIME detection: Apache Tika content sniffing");
            return new TikaMimeSniffer();
        }
        log.warn("MIME detection: declared type only (contentSniffing={}, tikaPresent={})",
                properties.isContentSniffing(), tikaPresent);
        return new DeclaredTypeMimeSniffer();
    }
}
