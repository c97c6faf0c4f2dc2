package com.tony.baseballAnalytics.repository;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvDataTypeMismatchException;
import com.opencsv.exceptions.CsvException;
import com.tony.baseballAnalytics.model.training.TrainingDataset;
import com.tony.baseballAnalytics.model.training.TrainingRow;
import com.tony.baseballAnalytics.service.ml.FeatureSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table d'entraînement au format CSV : une colonne par feature puis {@code primary_tactic}.
 * Une cellule vide (feature absente de la ligne) est relue comme 0.
 */
@Repository
@Slf4j
public class TrainingDatasetCsvRepository {

    public static final String LABEL_COLUMN = "primary_tactic";

    public void save(TrainingDataset dataset, Path path) throws IOException {
        FeatureSchema schema = FeatureSchema.fromColumns(dataset.columns());
        if (path.toAbsolutePath().getParent() != null) {
            Files.createDirectories(path.toAbsolutePath().getParent());
        }

        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            String[] header = new String[schema.size() + 1];
            for (int i = 0; i < schema.size(); i++) header[i] = schema.names().get(i);
            header[schema.size()] = LABEL_COLUMN;
            writer.writeNext(header);

            for (TrainingRow row : dataset.rows()) {
                String[] line = new String[header.length];
                for (int i = 0; i < schema.size(); i++) {
                    Double v = row.features().get(schema.names().get(i));
                    line[i] = v != null ? String.valueOf(v) : "";
                }
                line[schema.size()] = row.label();
                writer.writeNext(line);
            }
        }
        log.info("💾 Table d'entraînement exportée : {} ({} lignes, {} features)", path, dataset.size(), schema.size());
    }

    public TrainingDataset load(Path path) throws IOException, CsvException {
        List<String[]> lines;
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            lines = reader.readAll();
        }
        if (lines.isEmpty()) return new TrainingDataset(List.of());

        String[] header = lines.get(0);
        int labelIndex = -1;
        for (int i = 0; i < header.length; i++) {
            if (LABEL_COLUMN.equals(header[i])) labelIndex = i;
        }
        if (labelIndex < 0) {
            throw new CsvDataTypeMismatchException(path.toString(), TrainingDataset.class,
                    "Colonne " + LABEL_COLUMN + " absente de " + path);
        }

        List<TrainingRow> rows = new ArrayList<>();
        for (int l = 1; l < lines.size(); l++) {
            String[] line = lines.get(l);
            Map<String, Double> features = new LinkedHashMap<>();
            for (int i = 0; i < header.length; i++) {
                if (i == labelIndex) continue;
                String cell = i < line.length ? line[i].trim() : "";
                features.put(header[i], parse(cell, l, header[i]));
            }
            rows.add(new TrainingRow(features, labelIndex < line.length ? line[labelIndex] : ""));
        }
        log.info("📂 Table d'entraînement chargée : {} ({} lignes)", path, rows.size());
        return new TrainingDataset(rows);
    }

    private static double parse(String cell, int line, String column) throws CsvDataTypeMismatchException {
        if (cell.isEmpty()) return 0.0;
        try {
            double value = Double.parseDouble(cell);
            return Double.isFinite(value) ? value : 0.0;
        } catch (NumberFormatException e) {
            CsvDataTypeMismatchException mismatch = new CsvDataTypeMismatchException(cell, Double.class,
                    String.format("Valeur non numérique ligne %d, colonne %s : %s", line, column, cell));
            mismatch.initCause(e);
            throw mismatch;
        }
    }
}
