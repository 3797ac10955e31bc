package com.taskhub.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Binds the {@code taskhub.upload.*} YAML properties into a typed bean.
 * <p>
 * Defaults mirror {@code application.yml}; tests instantiate this class
 * directly and tweak the fields they care about.
 * </p>
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "taskhub.upload")
public class UploadProperties {

    public static final long MIB = 1024L * 1024L;

    /** Hard ceiling for a single file, checked before and after the write. */
    @Min(1)
    private long maxFileSize = 10 * MIB;

    @Min(1)
    private int maxFilesPerUpload = 10;

    /** Runs the pattern/entropy scanner in the strict profile. */
    private boolean scanContent = true;

    /** Use Tika to sniff content types when it is on the classpath. */
    private boolean contentSniffing = true;

    private Set<String> allowedExtensions = new LinkedHashSet<>(Set.of(
            ".pdf", ".doc", ".docx", ".txt", ".rtf", ".odt",
            ".jpg", ".jpeg", ".png", ".gif", ".bmp", ".svg", ".webp",
            ".xls", ".xlsx", ".csv", ".ods",
            ".ppt", ".pptx", ".odp",
            ".zip", ".rar", ".7z", ".tar", ".gz",
            ".py", ".js", ".html", ".css", ".json", ".xml", ".sql",
            ".mp4", ".avi", ".mov", ".wmv", ".mp3", ".wav", ".flac"));

    private Set<String> blockedExtensions = new LinkedHashSet<>(Set.of(
            ".exe", ".bat", ".cmd", ".com", ".scr", ".pif", ".vbs", ".js",
            ".jar", ".class", ".php", ".asp", ".aspx", ".jsp", ".py", ".pl",
            ".sh", ".ps1", ".dll", ".sys", ".drv", ".ocx", ".cpl", ".msi"));

    private Set<String> allowedMimeTypes = new LinkedHashSet<>(Set.of(
            "application/pdf",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "text/plain",
            "text/rtf",
            "application/vnd.oasis.opendocument.text",
            "image/jpeg", "image/png", "image/gif", "image/bmp", "image/svg+xml", "image/webp",
            "application/vnd.ms-excel",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "text/csv",
            "application/vnd.oasis.opendocument.spreadsheet",
            "application/vnd.ms-powerpoint",
            "application/vnd.openxmlformats-officedocument.presentationml.presentation",
            "application/vnd.oasis.opendocument.presentation",
            "application/zip", "application/x-rar-compressed", "application/x-7z-compressed",
            "application/x-tar", "application/gzip",
            "text/x-python", "application/javascript", "text/html", "text/css",
            "application/json", "application/xml", "text/x-sql",
            "video/mp4", "video/avi", "video/quicktime", "video/x-ms-wmv",
            "audio/mpeg", "audio/wav", "audio/flac"));

    @Valid
    private SizeLimits sizeLimits = new SizeLimits();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Cleanup cleanup = new Cleanup();

    /** Per-category ceilings applied after the write. */
    @Getter
    @Setter
    public static class SizeLimits {
        @Min(1)
        private long image = 5 * MIB;
        @Min(1)
        private long video = 50 * MIB;
        @Min(1)
        private long audio = 20 * MIB;
        @Min(1)
        private long archive = 25 * MIB;
        @Min(1)
        private long document = 10 * MIB;
        @Min(1)
        private long defaultLimit = 10 * MIB;
    }

    @Getter
    @Setter
    public static class RateLimit {
        @Min(1)
        private int uploadsPerMinute = 10;
        @Min(1)
        private int uploadsPerHour = 50;
        @Min(1)
        private int uploadsPerDay = 200;
        @Min(1)
        private long totalSizePerHour = 100 * MIB;
        @Min(1)
        private long totalSizePerDay = 500 * MIB;
    }

    @Getter
    @Setter
    public static class Storage {
        @NotBlank
        private String root = "uploads";
        /** Reserved; created at startup but not written by the pipeline. */
        @NotBlank
        private String tempDir = "temp";
        /** Configured for operators only. Never invoked by the pipeline. */
        private String virusScanCommand = "clamscan";
    }

    @Getter
    @Setter
    public static class Cleanup {
        private boolean enabled = true;
        @Min(1000)
        private long intervalMs = 3_600_000;
        /** Unreferenced files younger than this may belong to an upload still being persisted. */
        @Min(0)
        private long minAgeMs = 600_000;
    }
}
