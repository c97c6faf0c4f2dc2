package com.tony.baseballAnalytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.baseballAnalytics.model.ContextAnalysis;
import com.tony.baseballAnalytics.model.MomentumAnalysis;
import com.tony.baseballAnalytics.model.PredictionResult;
import com.tony.baseballAnalytics.model.Recommendation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Sorties d'un {@link PredictionResult} pour les collaborateurs en aval : document clé/valeur à plat et rapport texte.
 */
@Service
@RequiredArgsConstructor
public class PredictionExportService {

    private final ObjectMapper objectMapper;

    /**
     * Aplatit le résultat : {@code tacticalProbabilities.OFFENSIVE.power_hitting}, {@code recommendations[0].tactic}...
     * Les enrichissements absents n'apparaissent pas.
     */
    public Map<String, Object> toFlatDocument(PredictionResult result) {
        Map<String, Object> flat = new LinkedHashMap<>();
        flatten("", objectMapper.valueToTree(result), flat);
        return flat;
    }

    public String toFlatJson(PredictionResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toFlatDocument(result));
    }

    private void flatten(String prefix, JsonNode node, Map<String, Object> out) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                flatten(prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey(), field.getValue(), out);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                flatten(prefix + "[" + i + "]", node.get(i), out);
            }
        } else if (node.isNumber()) {
            out.put(prefix, node.numberValue());
        } else if (node.isBoolean()) {
            out.put(prefix, node.booleanValue());
        } else if (!node.isNull() && !node.isMissingNode()) {
            out.put(prefix, node.asText());
        }
    }

    public String toTextReport(PredictionResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Rapport d'analyse tactique\n");
        sb.append("=".repeat(50)).append("\n\n");

        sb.append("Probabilités par catégorie :\n").append("-".repeat(30)).append("\n");
        result.getTacticalProbabilities().forEach((category, tactics) -> {
            if (tactics.isEmpty()) return;
            sb.append("\n").append(category).append(" :\n");
            tactics.forEach((tactic, prob) -> sb.append(String.format(Locale.ROOT, "  %-25s %5.1f%%%n", tactic, prob)));
        });

        sb.append("\nRecommandations :\n").append("-".repeat(30)).append("\n");
        for (Recommendation rec : result.getRecommendations()) {
            sb.append(String.format(Locale.ROOT, "%n%s (%.2f%%) :%n", rec.getTactic(), rec.getProbability()));
            sb.append("Raisons : ").append(rec.getReasoning()).append("\n");
            sb.append("Actions :\n");
            rec.getSpecificActions().forEach(a -> sb.append("  - ").append(a).append("\n"));
        }

        ContextAnalysis context = result.getContextAnalysis();
        if (context != null) {
            sb.append("\nSituation :\n").append("-".repeat(30)).append("\n");
            sb.append("Manche : ").append(context.getGameSituation().getInning()).append("\n");
            sb.append("Retraits : ").append(context.getGameSituation().getOuts()).append("\n");
            sb.append(String.format(Locale.ROOT, "Indice de pression : %.2f%n", context.getGameSituation().getPressureIndex()));
            sb.append("Coureurs : ").append(context.getRunnerSituation().getRunners()).append("\n");
            sb.append("Position de marquer : ").append(context.getRunnerSituation().isScoringPosition() ? "Oui" : "Non").append("\n");
        }

        MomentumAnalysis momentum = result.getMomentumAnalysis();
        if (momentum != null) {
            sb.append("\nMomentum :\n").append("-".repeat(30)).append("\n");
            sb.append(String.format(Locale.ROOT, "Attaque : %.2f (sous pression %.2f)%n",
                    momentum.getBattingTeam().getRecentSuccess(), momentum.getBattingTeam().getPressureHandling()));
            sb.append(String.format(Locale.ROOT, "Défense : %.2f (sous pression %.2f)%n",
                    momentum.getPitchingTeam().getRecentSuccess(), momentum.getPitchingTeam().getPressureHandling()));
        }

        if (result.getHistoricalPatterns() != null) {
            sb.append("\nSituations similaires : ").append(result.getHistoricalPatterns().getSampleSize()).append("\n");
        }

        if (result.getPlayerAnalysis() != null) {
            sb.append("\nDuel frappeur / lanceur : avantage ").append(result.getPlayerAnalysis().getAdvantage()).append("\n");
            result.getPlayerAnalysis().getKeyFactors().forEach(f -> sb.append("  * ").append(f.description()).append("\n"));
        }
        return sb.toString();
    }
}
