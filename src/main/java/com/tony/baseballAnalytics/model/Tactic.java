package com.tony.baseballAnalytics.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.tony.baseballAnalytics.model.ContextCondition.atLeast;
import static com.tony.baseballAnalytics.model.ContextCondition.atMost;
import static com.tony.baseballAnalytics.model.ContextCondition.between;
import static com.tony.baseballAnalytics.model.ContextCondition.is;
import static com.tony.baseballAnalytics.model.SituationField.*;

/**
 * Taxonomie tactique figée : catégorie, actions déclencheuses et prédicat de contexte de chaque tactique.
 * L'ordre de déclaration fait foi pour départager les égalités.
 */
public enum Tactic {

    // --- OFFENSIVE ---
    POWER_HITTING(TacticCategory.OFFENSIVE, "power_hitting",
            List.of("Home Run", "Double", "Triple"),
            List.of(atLeast("min_runners", NUM_RUNNERS, 1),
                    is("scoring_position", SCORING_POSITION, true),
                    atLeast("min_pressure", PRESSURE_INDEX, 1.5))),
    CONTACT_HITTING(TacticCategory.OFFENSIVE, "contact_hitting",
            List.of("Single", "Ground Ball"),
            List.of(atMost("max_pressure", PRESSURE_INDEX, 1.5),
                    atMost("max_outs", OUTS, 2))),
    SMALL_BALL(TacticCategory.OFFENSIVE, "small_ball",
            List.of("Sac Bunt", "Sac Fly", "Bunt Groundout"),
            List.of(between("score_diff_range", SCORE_DIFF, -2, 2),
                    atMost("max_outs", OUTS, 1))),
    PATIENT_HITTING(TacticCategory.OFFENSIVE, "patient_hitting",
            List.of("Walk", "Hit By Pitch", "Intent Walk"),
            List.of(atLeast("min_balls", BALLS, 2),
                    atMost("max_strikes", STRIKES, 1))),

    // --- BASERUNNING ---
    AGGRESSIVE_BASERUNNING(TacticCategory.BASERUNNING, "aggressive_baserunning",
            List.of("Stolen Base 2B", "Stolen Base 3B", "Stolen Base Home", "Triple"),
            List.of(atMost("max_outs", OUTS, 1),
                    atLeast("min_offensive_opportunity", OFFENSIVE_OPPORTUNITY, 1.0))),
    CONSERVATIVE_BASERUNNING(TacticCategory.BASERUNNING, "conservative_baserunning",
            List.of("Pickoff", "Caught Stealing", "Pickoff Caught Stealing"),
            List.of(atLeast("min_pressure", PRESSURE_INDEX, 1.5))),

    // --- DEFENSIVE ---
    DEFENSIVE_OUTS(TacticCategory.DEFENSIVE, "defensive_outs",
            List.of("Groundout", "Flyout", "Lineout", "Pop Out", "Forceout"),
            List.of(atLeast("min_defensive_pressure", DEFENSIVE_PRESSURE, 1.0))),
    STRIKEOUT_PITCHING(TacticCategory.DEFENSIVE, "strikeout_pitching",
            List.of("Strikeout", "Strikeout Double Play"),
            List.of(atLeast("min_strikes", STRIKES, 2))),
    DOUBLE_PLAY(TacticCategory.DEFENSIVE, "double_play",
            List.of("Double Play", "Grounded Into DP", "Triple Play"),
            List.of(atLeast("min_runners", NUM_RUNNERS, 1),
                    atMost("max_outs", OUTS, 2))),
    FIELD_DEFENSE(TacticCategory.DEFENSIVE, "field_defense",
            List.of("Field Error", "Pickoff", "Caught Stealing"),
            List.of(atLeast("min_defensive_pressure", DEFENSIVE_PRESSURE, 1.5)));

    private final TacticCategory category;
    private final String code;
    private final List<String> actions;
    private final List<ContextCondition> contexts;

    Tactic(TacticCategory category, String code, List<String> actions, List<ContextCondition> contexts) {
        this.category = category;
        this.code = code;
        this.actions = actions;
        this.contexts = contexts;
    }

    public TacticCategory getCategory() { return category; }
    public String getCode() { return code; }
    public List<String> getActions() { return actions; }
    public List<ContextCondition> getContexts() { return contexts; }

    public static Optional<Tactic> fromCode(String code) {
        return Arrays.stream(values()).filter(t -> t.code.equals(code)).findFirst();
    }
}
