package com.tony.baseballAnalytics.model;

import java.util.*;

/**
 * Index en lecture seule construit une fois au chargement de la classe à partir de {@link Tactic}.
 * Partageable sans verrou entre les threads d'entraînement.
 */
public final class TacticalTaxonomy {

    public static final String FALLBACK_TACTIC = Tactic.CONTACT_HITTING.getCode();

    private static final Map<String, List<Tactic>> ACTION_TO_TACTICS;
    private static final Set<String> HITTING_ACTIONS;
    private static final Set<String> BASERUNNING_ACTIONS;
    private static final Set<String> FIELDING_ACTIONS;

    static {
        Map<String, List<Tactic>> index = new LinkedHashMap<>();
        Map<TacticCategory, Set<String>> vocabulary = new EnumMap<>(TacticCategory.class);
        for (Tactic tactic : Tactic.values()) {
            for (String action : tactic.getActions()) {
                index.computeIfAbsent(action, a -> new ArrayList<>()).add(tactic);
                vocabulary.computeIfAbsent(tactic.getCategory(), c -> new LinkedHashSet<>()).add(action);
            }
        }
        index.replaceAll((action, tactics) -> List.copyOf(tactics));
        ACTION_TO_TACTICS = Collections.unmodifiableMap(index);
        HITTING_ACTIONS = Collections.unmodifiableSet(vocabulary.get(TacticCategory.OFFENSIVE));
        BASERUNNING_ACTIONS = Collections.unmodifiableSet(vocabulary.get(TacticCategory.BASERUNNING));
        FIELDING_ACTIONS = Collections.unmodifiableSet(vocabulary.get(TacticCategory.DEFENSIVE));
    }

    private TacticalTaxonomy() {
    }

    /**
     * Tactiques candidates pour une action, dans l'ordre de la taxonomie. Liste vide si l'action n'est pas mappée.
     */
    public static List<Tactic> tacticsFor(String action) {
        return action == null ? List.of() : ACTION_TO_TACTICS.getOrDefault(action, List.of());
    }

    public static boolean isKnownAction(String action) {
        return HITTING_ACTIONS.contains(action) || BASERUNNING_ACTIONS.contains(action) || FIELDING_ACTIONS.contains(action);
    }

    public static Set<String> knownActions() {
        Set<String> all = new LinkedHashSet<>(HITTING_ACTIONS);
        all.addAll(BASERUNNING_ACTIONS);
        all.addAll(FIELDING_ACTIONS);
        return Collections.unmodifiableSet(all);
    }

    public static Optional<TacticCategory> categoryOf(String tacticCode) {
        return Tactic.fromCode(tacticCode).map(Tactic::getCategory);
    }

    public static List<String> actionsOf(String tacticCode) {
        return Tactic.fromCode(tacticCode).map(Tactic::getActions).orElse(List.of());
    }
}
