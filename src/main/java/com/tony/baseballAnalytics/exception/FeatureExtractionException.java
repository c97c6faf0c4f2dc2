package com.tony.baseballAnalytics.exception;

/**
 * Action de jeu mal formée : champ obligatoire absent ou valeur hors bornes.
 */
public class FeatureExtractionException extends RuntimeException {

    public FeatureExtractionException(String message) {
        super(message);
    }
}
