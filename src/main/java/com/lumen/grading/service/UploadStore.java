package com.lumen.grading.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.InvalidUploadException;

import lombok.extern.slf4j.Slf4j;

/**
 * File storage for uploaded images and documents.
 *
 * Files are saved under the configured directory with a generated name; the
 * name is the opaque reference stored on the submission.
 */
@Service
@Slf4j
public class UploadStore {

    public static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif");
    public static final Set<String> DOCUMENT_EXTENSIONS = Set.of("pdf", "docx");
    public static final Set<String> TEXT_EXTENSIONS = Set.of("txt");

    private static final Pattern REFERENCE = Pattern.compile("[0-9a-f\\-]{36}\\.(jpg|jpeg|png|gif|pdf|docx)");

    private final Path directory;
    private final long maxBytes;

    public UploadStore(GradingProperties properties) {
        this.directory = Paths.get(properties.getUploads().getDirectory()).toAbsolutePath().normalize();
        this.maxBytes = properties.getUploads().getMaxBytes();
    }

    /**
     * Lower-case extension of a file name, or "" if it has none.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static boolean isImage(String filename) {
        return IMAGE_EXTENSIONS.contains(extensionOf(filename));
    }

    public static boolean isDocument(String filename) {
        return DOCUMENT_EXTENSIONS.contains(extensionOf(filename));
    }

    public static boolean isText(String filename) {
        return TEXT_EXTENSIONS.contains(extensionOf(filename));
    }

    /**
     * Check size limits shared by every upload.
     */
    public void checkSize(byte[] content) {
        if (content == null || content.length == 0) {
            throw new InvalidUploadException("Uploaded file is empty");
        }
        if (content.length > maxBytes) {
            throw new InvalidUploadException("Uploaded file exceeds " + maxBytes + " bytes");
        }
    }

    /**
     * Save an image or document and return its reference. The reference keeps
     * the file's extension.
     */
    public String store(String originalFilename, byte[] content) {
        if (!isImage(originalFilename) && !isDocument(originalFilename)) {
            throw new InvalidUploadException("Unsupported upload type: " + originalFilename);
        }
        checkSize(content);

        String reference = UUID.randomUUID() + "." + extensionOf(originalFilename);
        try {
            Files.createDirectories(directory);
            Files.write(directory.resolve(reference), content);
        } catch (IOException e) {
            throw new InvalidUploadException("Could not store upload " + originalFilename, e);
        }

        log.debug("Stored upload {} as {}", originalFilename, reference);
        return reference;
    }

    /**
     * Load a stored upload.
     *
     * @throws InvalidUploadException if the reference is malformed or the file is gone
     */
    public byte[] load(String reference) {
        if (reference == null || !REFERENCE.matcher(reference).matches()) {
            throw new InvalidUploadException("Invalid upload reference: " + reference);
        }
        try {
            return Files.readAllBytes(directory.resolve(reference));
        } catch (NoSuchFileException e) {
            throw new InvalidUploadException("Upload not found: " + reference, e);
        } catch (IOException e) {
            throw new InvalidUploadException("Could not read upload " + reference, e);
        }
    }
}
