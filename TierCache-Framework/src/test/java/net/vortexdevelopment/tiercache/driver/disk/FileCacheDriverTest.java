package net.vortexdevelopment.tiercache.driver.disk;

import net.vortexdevelopment.tiercache.exception.CacheConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileCacheDriverTest {

    @TempDir
    Path root;

    private FileCacheDriver driver;

    @BeforeEach
    void setUp() {
        driver = new FileCacheDriver(root);
    }

    @Test
    void storedValueIsReadBack() {
        List<String> value = new ArrayList<>(List.of("a", "b"));

        assertThat(driver.store("list", (Serializable) value, "cot")).isTrue();

        assertThat(driver.exists("list", "cot")).isTrue();
        assertThat(driver.get("list", "cot")).contains(value);
    }

    @Test
    void missingEntryIsAbsentNotAnError() {
        assertThat(driver.exists("nothing", "cot")).isFalse();
        assertThat(driver.get("nothing", "cot")).isEmpty();
        assertThat(driver.remove("nothing", "cot")).isFalse();
    }

    @Test
    void laterStoreReplacesEarlierOne() {
        driver.store("key", "first", "cot");
        driver.store("key", "second", "cot");

        assertThat(driver.get("key", "cot")).contains("second");
    }

    @Test
    void removeDeletesTheEntry() {
        driver.store("key", "value", "cot");

        assertThat(driver.remove("key", "cot")).isTrue();

        assertThat(driver.exists("key", "cot")).isFalse();
    }

    @Test
    void clearRealmLeavesOtherRealmsAlone() {
        // Arrange
        driver.store("x", 1, "A");
        driver.store("x", 2, "B");

        // Act
        boolean cleared = driver.clear("A");

        // Assert
        assertThat(cleared).isTrue();
        assertThat(driver.exists("x", "A")).isFalse();
        assertThat(driver.get("x", "B")).contains(2);
    }

    @Test
    void clearAllEmptiesEveryRealm() {
        driver.store("x", 1, "A");
        driver.store("y", 2, "B");

        assertThat(driver.clear("")).isTrue();

        assertThat(driver.exists("x", "A")).isFalse();
        assertThat(driver.exists("y", "B")).isFalse();
    }

    @Test
    void clearOfUnknownRealmSucceeds() {
        assertThat(driver.clear("never-used")).isTrue();
    }

    @Test
    void idsWithPathCharactersStayInsideTheRealm() {
        driver.store("../escape", "value", "cot");
        driver.store("..", "dots", "cot");

        assertThat(driver.get("../escape", "cot")).contains("value");
        assertThat(driver.get("..", "cot")).contains("dots");
        assertThat(root.resolve("escape")).doesNotExist();
        assertThat(root.resolve("cot")).isDirectory();
    }

    @Test
    void emptyIdIsRejected() {
        assertThatThrownBy(() -> driver.store("", "value", "cot"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingRootIsAConfigurationError(@TempDir Path parent) {
        Path missing = parent.resolve("does-not-exist");

        assertThatThrownBy(() -> new FileCacheDriver(missing))
                .isInstanceOf(CacheConfigurationException.class)
                .hasMessageContaining("not writable");
    }

    @Test
    void fileAsRootIsAConfigurationError(@TempDir Path parent) throws Exception {
        Path file = Files.createFile(parent.resolve("plain-file"));

        assertThatThrownBy(() -> new FileCacheDriver(file))
                .isInstanceOf(CacheConfigurationException.class);
    }
}
