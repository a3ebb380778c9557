package dev.badgersnacks.packmigrator.services;

import dev.badgersnacks.packmigrator.model.AssetKind;
import dev.badgersnacks.packmigrator.model.PredicateEncoding;
import dev.badgersnacks.packmigrator.persistence.RelocationRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetProfileTest {

    @Test
    void mapsVersionsToPackFormats() {
        assertEquals(46, TargetProfile.forVersion("1.21.4").packFormat());
        assertEquals(34, TargetProfile.forVersion("1.21.1").packFormat());
        assertEquals(15, TargetProfile.forVersion("1.20.1").packFormat());
        assertEquals(4, TargetProfile.forVersion("1.14.4").packFormat());
        assertEquals(64, TargetProfile.forVersion("1.21.8").packFormat());
    }

    @Test
    void itemDefinitionsStartWithVersion1214() {
        assertEquals(PredicateEncoding.PREDICATE, TargetProfile.forVersion("1.21.3").defaultEncoding());
        assertEquals(PredicateEncoding.RANGE_DISPATCH, TargetProfile.forVersion("1.21.4").defaultEncoding());
    }

    @Test
    void rejectsUnsupportedVersions() {
        assertThrows(IllegalArgumentException.class, () -> TargetProfile.forVersion("1.12.2"));
        assertThrows(IllegalArgumentException.class, () -> TargetProfile.forVersion("snapshot"));
    }

    @Test
    void layoutMovesItemDefinitionsOnlyForComponentEncodings() {
        assertTrue(TargetProfile.layoutFor(PredicateEncoding.PREDICATE).isEmpty());
        List<RelocationRule> rules = TargetProfile.layoutFor(PredicateEncoding.SELECT);
        assertEquals(1, rules.size());
        assertEquals(AssetKind.ITEM_DEFINITION, rules.get(0).kind());
        assertEquals("assets/minecraft/items/stick.json",
                rules.get(0).relocate("assets/minecraft/models/item/stick.json").orElseThrow());
    }
}
