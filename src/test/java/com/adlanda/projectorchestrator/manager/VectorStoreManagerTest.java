package com.adlanda.projectorchestrator.manager;

import com.adlanda.projectorchestrator.exception.ProjectMismatchException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.document.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VectorStoreManagerTest {

    @TempDir
    Path storesDir;

    private LetterCountEmbeddingModel embeddingModel;
    private VectorStoreManager manager;

    @BeforeEach
    void setUp() {
        embeddingModel = new LetterCountEmbeddingModel();
        manager = new VectorStoreManager(storesDir, embeddingModel, new ObjectMapper());
    }

    @Test
    void switchProject_noIndexYet_opensEmptyStore() {
        assertThat(manager.switchProject("p1")).isTrue();

        assertThat(manager.current()).contains("p1");
        assertThat(manager.size()).isZero();
        assertThat(manager.search("p1", "anything", 5)).isEmpty();
    }

    @Test
    void addDocuments_persistsIndexFile() {
        manager.switchProject("p1");

        int size = manager.addDocuments("p1", List.of(doc("d1", "aaaa"), doc("d2", "zzzz")));

        assertThat(size).isEqualTo(2);
        assertThat(manager.storeFile("p1")).isRegularFile();
    }

    @Test
    void addDocuments_sameId_replacesDocument() {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "aaaa")));

        int size = manager.addDocuments("p1", List.of(doc("d1", "bbbb")));

        assertThat(size).isEqualTo(1);
    }

    @Test
    void search_returnsMostSimilarFirst() {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "aaaa aaaa"), doc("d2", "zzzz zzzz")));

        List<Document> results = manager.search("p1", "zz", 2);

        assertThat(results).isNotEmpty();
        assertThat(results.get(0).getId()).isEqualTo("d2");
        assertThat(results.get(0).getScore()).isNotNull();
    }

    @Test
    void switchBack_reloadsPersistedIndex() {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "aaaa"), doc("d2", "zzzz")));

        manager.switchProject("p2");
        assertThat(manager.size()).isZero();

        manager.switchProject("p1");
        assertThat(manager.size()).isEqualTo(2);
        assertThat(manager.search("p1", "aaaa", 1)).extracting(Document::getId).containsExactly("d1");
    }

    @Test
    void newManagerInstance_readsIndexWrittenByPreviousOne() {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "hello")));

        VectorStoreManager restarted = new VectorStoreManager(storesDir, embeddingModel, new ObjectMapper());

        assertThat(restarted.switchProject("p1")).isTrue();
        assertThat(restarted.size()).isEqualTo(1);
    }

    @Test
    void operations_forOtherProject_throwMismatch() {
        manager.switchProject("p1");

        assertThatThrownBy(() -> manager.addDocuments("p2", List.of(doc("d1", "x"))))
                .isInstanceOf(ProjectMismatchException.class);
        assertThatThrownBy(() -> manager.search("p2", "x", 1))
                .isInstanceOf(ProjectMismatchException.class);
    }

    @Test
    void operations_withNothingLoaded_throwMismatch() {
        assertThatThrownBy(() -> manager.search("p1", "x", 1))
                .isInstanceOf(ProjectMismatchException.class);
    }

    @Test
    void switchProject_corruptIndex_returnsFalse() throws IOException {
        Files.writeString(storesDir.resolve("p1.json"), "{broken");

        assertThat(manager.switchProject("p1")).isFalse();
        assertThat(manager.current()).isEmpty();
        assertThat(manager.size()).isZero();
    }

    @Test
    void switchProject_sameProject_doesNotReopen() {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "hello")));

        assertThat(manager.switchProject("p1")).isTrue();
        assertThat(manager.size()).isEqualTo(1);
    }

    @Test
    void deleteDocuments_removesFromIndexAndFile() {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "aaaa aaaa"), doc("d2", "zzzz zzzz")));

        int removed = manager.deleteDocuments("p1", List.of("d2", "unknown"));

        assertThat(removed).isEqualTo(1);
        assertThat(manager.size()).isEqualTo(1);
        assertThat(manager.search("p1", "zz", 5)).extracting(Document::getId).containsExactly("d1");

        VectorStoreManager restarted = new VectorStoreManager(storesDir, embeddingModel, new ObjectMapper());
        restarted.switchProject("p1");
        assertThat(restarted.documentSources("p1")).containsOnlyKeys("d1");
    }

    @Test
    void deleteDocuments_unknownIds_leavesIndexUntouched() {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "aaaa")));

        assertThat(manager.deleteDocuments("p1", List.of("nope"))).isZero();
        assertThat(manager.size()).isEqualTo(1);
    }

    @Test
    void documentSources_afterReload_mapsIdsToSourceFiles() {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "aaaa"), doc("d2", "zzzz")));
        manager.switchProject("p2");

        manager.switchProject("p1");

        assertThat(manager.documentSources("p1"))
                .containsEntry("d1", "d1.txt")
                .containsEntry("d2", "d2.txt")
                .hasSize(2);
    }

    @Test
    void deleteArtifacts_removesIndexFileOfUnloadedProject() throws IOException {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "aaaa")));
        manager.switchProject("p2");

        manager.deleteArtifacts("p1");

        assertThat(manager.storeFile("p1")).doesNotExist();
    }

    @Test
    void deleteArtifacts_loadedProject_isRejected() {
        manager.switchProject("p1");
        manager.addDocuments("p1", List.of(doc("d1", "aaaa")));

        assertThatThrownBy(() -> manager.deleteArtifacts("p1"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(manager.storeFile("p1")).isRegularFile();
    }

    private static Document doc(String id, String text) {
        return new Document(id, text, Map.of("sourceFile", id + ".txt", "chunkIndex", 0));
    }
}
