package com.initialone.jmigrate.model;

import com.initialone.jmigrate.migrate.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RenameCatalogueTests {

    @Test
    void builtInMigrationHasFifteenRulesWithDMarker() {
        RenameCatalogue c = Migration.UPGRADE_7TO8.catalogue();
        assertEquals("7to8", c.name());
        assertEquals("d", c.marker());
        assertEquals(15, c.rules().size());
        assertTrue(c.legacyNames().containsAll(List.of("center", "size_info", "movex", "ysize")));
        assertEquals("dcenter", c.rules().get(0).shadowName());
    }

    @Test
    void rulesAreImmutable() {
        RenameCatalogue c = RenameCatalogue.of("t", "d", List.of("a", "b"));
        assertThrows(UnsupportedOperationException.class, () -> c.rules().clear());
    }

    @Test
    void rejectsDuplicateNames() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> RenameCatalogue.of("t", "d", List.of("x", "y", "x")));
        assertTrue(e.getMessage().contains("duplicate"));
    }

    @Test
    void rejectsEmptyCatalogue() {
        assertThrows(ConfigurationException.class, () -> RenameCatalogue.of("t", "d", List.of()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1abc", "a-b", "a.b", "a b", "", "(x)"})
    void rejectsNonIdentifierNames(String bad) {
        assertThrows(ConfigurationException.class, () -> RenameCatalogue.of("t", "d", List.of("ok", bad)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "9", "d.", "$"})
    void rejectsNonIdentifierMarker(String bad) {
        assertThrows(ConfigurationException.class, () -> RenameCatalogue.of("t", bad, List.of("ok")));
    }

    @Test
    void loadsCatalogueFromJson(@TempDir Path tmp) throws Exception {
        Path f = tmp.resolve("geom.json");
        Files.writeString(f, "{\"name\": \"geom\", \"marker\": \"old_\", \"names\": [\"width\", \"height\"]}",
                StandardCharsets.UTF_8);

        RenameCatalogue c = RenameCatalogue.fromJson(f);

        assertEquals("geom", c.name());
        assertEquals("old_", c.marker());
        assertEquals(List.of("width", "height"), c.legacyNames());
    }

    @Test
    void jsonWithoutNameFallsBackToFileName(@TempDir Path tmp) throws Exception {
        Path f = tmp.resolve("cat.json");
        Files.writeString(f, "{\"marker\": \"d\", \"names\": [\"a\"]}", StandardCharsets.UTF_8);
        assertEquals("cat.json", RenameCatalogue.fromJson(f).name());
    }

    @Test
    void jsonIsValidatedLikeCode(@TempDir Path tmp) throws Exception {
        Path f = tmp.resolve("dup.json");
        Files.writeString(f, "{\"marker\": \"d\", \"names\": [\"a\", \"a\"]}", StandardCharsets.UTF_8);
        assertThrows(ConfigurationException.class, () -> RenameCatalogue.fromJson(f));
    }

    @Test
    void malformedJsonIsAConfigurationError(@TempDir Path tmp) throws Exception {
        Path f = tmp.resolve("broken.json");
        Files.writeString(f, "{\"marker\": \"d\", \"names\": [", StandardCharsets.UTF_8);
        assertThrows(ConfigurationException.class, () -> RenameCatalogue.fromJson(f));
    }

    @Test
    void missingJsonIsNotFound(@TempDir Path tmp) {
        assertThrows(NoSuchFileException.class, () -> RenameCatalogue.fromJson(tmp.resolve("nope.json")));
    }

    @Test
    void migrationIdsAreCaseInsensitive() {
        assertSame(Migration.UPGRADE_7TO8, Migration.fromId("7to8"));
        assertSame(Migration.UPGRADE_7TO8, Migration.fromId("7TO8"));
        assertSame(Migration.UPGRADE_7TO8, Migration.fromId("upgrade_7to8"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Migration.fromId("6to7"));
        assertTrue(e.getMessage().contains("7to8"));
    }
}
