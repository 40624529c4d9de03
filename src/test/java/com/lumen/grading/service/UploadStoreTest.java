package com.lumen.grading.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.lumen.grading.config.GradingProperties;
import com.lumen.grading.exception.InvalidUploadException;

class UploadStoreTest {

    @TempDir
    Path uploads;

    private UploadStore store;

    @BeforeEach
    void setUp() {
        GradingProperties properties = new GradingProperties();
        properties.getUploads().setDirectory(uploads.toString());
        properties.getUploads().setMaxBytes(16);
        store = new UploadStore(properties);
    }

    @Test
    void storedImageCanBeLoadedBack() {
        String reference = store.store("Essay.JPG", new byte[] {9, 8, 7});

        assertThat(reference).endsWith(".jpg");
        assertThat(store.load(reference)).containsExactly(9, 8, 7);
    }

    @Test
    void documentsAreStoredWithTheirExtension() {
        String pdf = store.store("Essay.PDF", new byte[] {'%', 'P', 'D', 'F'});
        String docx = store.store("essay.docx", new byte[] {'P', 'K'});

        assertThat(pdf).endsWith(".pdf");
        assertThat(docx).endsWith(".docx");
        assertThat(store.load(pdf)).containsExactly('%', 'P', 'D', 'F');
        assertThat(UploadStore.isDocument("essay.docx")).isTrue();
    }

    @Test
    void rejectsUnsupportedExtensions() {
        assertThatThrownBy(() -> store.store("essay.doc", new byte[] {1}))
                .isInstanceOf(InvalidUploadException.class);
        assertThatThrownBy(() -> store.store("essay.txt", new byte[] {1}))
                .isInstanceOf(InvalidUploadException.class);
        assertThat(UploadStore.isText("notes.TXT")).isTrue();
        assertThat(UploadStore.isImage("photo.gif")).isTrue();
        assertThat(UploadStore.isImage("archive")).isFalse();
    }

    @Test
    void rejectsEmptyAndOversizedFiles() {
        assertThatThrownBy(() -> store.store("a.png", new byte[0]))
                .isInstanceOf(InvalidUploadException.class);
        assertThatThrownBy(() -> store.store("a.png", new byte[17]))
                .isInstanceOf(InvalidUploadException.class);
    }

    @Test
    void rejectsReferencesOutsideTheStore() {
        assertThatThrownBy(() -> store.load("../../etc/passwd"))
                .isInstanceOf(InvalidUploadException.class);
        assertThatThrownBy(() -> store.load("0f8fad5b-d9cb-469f-a165-70867728950e.png"))
                .isInstanceOf(InvalidUploadException.class)
                .hasMessageContaining("not found");
    }
}
