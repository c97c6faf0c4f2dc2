package com.tony.baseballAnalytics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TacticalTaxonomyTest {

    @Test
    @DisplayName("Une action partagée renvoie ses tactiques dans l'ordre de déclaration")
    void sharedActionsKeepDeclarationOrder() {
        assertThat(TacticalTaxonomy.tacticsFor("Triple"))
                .containsExactly(Tactic.POWER_HITTING, Tactic.AGGRESSIVE_BASERUNNING);
        assertThat(TacticalTaxonomy.tacticsFor("Pickoff"))
                .containsExactly(Tactic.CONSERVATIVE_BASERUNNING, Tactic.FIELD_DEFENSE);
    }

    @Test
    @DisplayName("Action inconnue ou nulle : aucune tactique")
    void unknownAction() {
        assertThat(TacticalTaxonomy.tacticsFor("Game Advisory")).isEmpty();
        assertThat(TacticalTaxonomy.tacticsFor(null)).isEmpty();
        assertThat(TacticalTaxonomy.isKnownAction("Game Advisory")).isFalse();
        assertThat(TacticalTaxonomy.isKnownAction("Sac Fly")).isTrue();
    }

    @Test
    @DisplayName("Catégorie et actions retrouvées depuis le code de la tactique")
    void lookupByCode() {
        assertThat(TacticalTaxonomy.categoryOf("double_play")).contains(TacticCategory.DEFENSIVE);
        assertThat(TacticalTaxonomy.categoryOf("hit_and_run")).isEmpty();
        assertThat(TacticalTaxonomy.actionsOf("small_ball")).containsExactly("Sac Bunt", "Sac Fly", "Bunt Groundout");
    }
}
