package com.initialone.jmigrate.rewrite;

import com.initialone.jmigrate.model.Migration;
import com.initialone.jmigrate.model.RenameCatalogue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Matcher;

import static org.junit.jupiter.api.Assertions.*;

class PatternCompilerTests {

    private final MatchPatterns patterns = PatternCompiler.compile(Migration.UPGRADE_7TO8.catalogue());

    @Test
    void qualifiedPatternMatchesOnlyStandaloneMarkerDotName() {
        assertTrue(patterns.qualified().matcher("d.center").find());
        assertTrue(patterns.qualified().matcher("(d.center)").find());
        assertFalse(patterns.qualified().matcher("xd.center").find());
        assertFalse(patterns.qualified().matcher("d.centered").find());
        assertFalse(patterns.qualified().matcher("p.center").find());
    }

    @Test
    void qualifiedPatternTreatsDotLiterally() {
        assertFalse(patterns.qualified().matcher("dXcenter").find());
        assertFalse(patterns.qualified().matcher("d_center").find());
    }

    @Test
    void barePatternRespectsIdentifierBoundaries() {
        assertFalse(patterns.bare().matcher("recentered").find());
        assertFalse(patterns.bare().matcher("size_info_2").find());

        Matcher m = patterns.bare().matcher("a.movex + b.move");
        assertTrue(m.find());
        assertEquals("movex", m.group(1));
        assertTrue(m.find());
        assertEquals("move", m.group(1));
        assertFalse(m.find());
    }

    @Test
    void everyCatalogueNameIsCovered() {
        RenameCatalogue c = Migration.UPGRADE_7TO8.catalogue();
        for (String name : c.legacyNames()) {
            assertTrue(patterns.bare().matcher(name).matches(), name);
            assertTrue(patterns.qualified().matcher("d." + name).matches(), name);
        }
    }

    @Test
    void keepsMarkerForReplacement() {
        MatchPatterns p = PatternCompiler.compile(RenameCatalogue.of("t", "shadow_", List.of("a")));
        assertEquals("shadow_", p.marker());
        assertTrue(p.qualified().matcher("shadow_.a").matches());
        assertFalse(p.qualified().matcher("d.a").matches());
    }
}
